/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.output;

import com.ascesis.ces.api.model.Structure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Serializes resolved structures for an external execution engine.
 *
 * <p>Polynomials are written as arrays of monomials, each an array of node
 * names; capacities as numbers or {@code "unbounded"}.
 */
public class StructureJsonWriter {
    private static final Logger logger = Logger.getLogger(StructureJsonWriter.class.getName());

    private final ObjectWriter writer;

    public StructureJsonWriter() {
        this(new ObjectMapper());
    }

    public StructureJsonWriter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public String toJson(Structure structure) throws JsonProcessingException {
        return writer.writeValueAsString(structure);
    }

    public void write(Structure structure, Path target) throws IOException {
        Files.writeString(target, toJson(structure));
        logger.fine(() -> "Wrote structure '" + structure.getName() + "' to " + target);
    }
}
