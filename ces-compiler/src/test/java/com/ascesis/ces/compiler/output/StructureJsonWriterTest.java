/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.output;

import com.ascesis.ces.api.ast.CesFile;
import com.ascesis.ces.api.ast.ContextDeclaration.CapacityDeclaration;
import com.ascesis.ces.api.ast.ContextDeclaration.InhibitorDeclaration;
import com.ascesis.ces.api.ast.ContextDeclaration.TitleDeclaration;
import com.ascesis.ces.api.ast.Face;
import com.ascesis.ces.api.ast.FatArrowRule;
import com.ascesis.ces.api.ast.Polynomial;
import com.ascesis.ces.api.ast.StructureDef;
import com.ascesis.ces.api.model.Capacity;
import com.ascesis.ces.api.model.Structure;
import com.ascesis.ces.compiler.CompilerConfig;
import com.ascesis.ces.compiler.StructureCompiler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StructureJsonWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private StructureJsonWriter writer;
    private Structure structure;

    @BeforeEach
    void setUp() {
        writer = new StructureJsonWriter();
        CesFile file = CesFile.of(StructureDef.immediate("Main",
                FatArrowRule.forward(Polynomial.of("a"), Polynomial.sum("b", "c")))).withContext(
                new TitleDeclaration("Choice", null),
                new CapacityDeclaration(Capacity.unbounded(), Polynomial.of("b"), null),
                new InhibitorDeclaration(Face.EFFECT, Polynomial.of("c"), Polynomial.of("a"), null));
        structure = new StructureCompiler(OpenTelemetry.noop().getTracer("test"), CompilerConfig.defaults())
                .resolve(file);
    }

    @Test
    void writesNodesWithPolynomialsAndCapacities() throws IOException {
        JsonNode json = mapper.readTree(writer.toJson(structure));

        assertThat(json.get("name").asText()).isEqualTo("Main");
        assertThat(json.get("title").asText()).isEqualTo("Choice");
        JsonNode a = json.get("nodes").get(0);
        assertThat(a.get("id").asText()).isEqualTo("a");
        assertThat(a.get("capacity").asLong()).isEqualTo(1L);
        assertThat(a.get("cause")).isEmpty();
        assertThat(a.get("effect").toString()).isEqualTo("[[\"b\"],[\"c\"]]");
        assertThat(json.get("nodes").get(1).get("capacity").asText()).isEqualTo("unbounded");
    }

    @Test
    void writesLinksInhibitorsAndStats() throws IOException {
        JsonNode json = mapper.readTree(writer.toJson(structure));

        JsonNode link = json.get("links").get(0);
        assertThat(link.get("source").asText()).isEqualTo("a");
        assertThat(link.get("target").asText()).isEqualTo("b");
        assertThat(link.get("kind").asText()).isEqualTo("FULL");
        assertThat(link.get("weight").asLong()).isEqualTo(1L);
        assertThat(link.has("full")).isFalse();

        JsonNode inhibitor = json.get("inhibitors").get(0);
        assertThat(inhibitor.get("source").asText()).isEqualTo("c");
        assertThat(inhibitor.get("face").asText()).isEqualTo("EFFECT");

        assertThat(json.get("stats").get("node_count").asInt()).isEqualTo(3);
        assertThat(json.get("stats").get("link_count").asInt()).isEqualTo(2);
        assertThat(json.get("warnings")).hasSize(3);
    }

    @Test
    void writesToFile(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("main.json");

        writer.write(structure, target);

        assertThat(mapper.readTree(Files.readString(target)).get("links")).hasSize(2);
    }
}
