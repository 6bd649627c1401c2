/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.loader;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON interchange form of a parsed file. Used only for loading.
 *
 * <p>Rule expressions and polynomials are polymorphic and kept as raw
 * {@link JsonNode}s; {@link CesFileLoader} converts them.
 */
public record CesFileDocument(
        @JsonProperty("origin") String origin,
        @JsonProperty("structures") List<StructureDefinition> structures,
        @JsonProperty("context") List<ContextDefinition> context
) {
    public List<StructureDefinition> structures() {
        return structures != null ? structures : List.of();
    }

    public List<ContextDefinition> context() {
        return context != null ? context : List.of();
    }

    public record StructureDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("params") List<ParamDefinition> params,
            @JsonProperty("body") JsonNode body,
            @JsonProperty("span") SpanDefinition span
    ) {
        public List<ParamDefinition> params() {
            return params != null ? params : List.of();
        }
    }

    public record ParamDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("kind") String kind
    ) {}

    public record SpanDefinition(
            @JsonProperty("start") int start,
            @JsonProperty("end") int end
    ) {}

    /**
     * One context declaration; {@code type} selects which of the other fields apply.
     */
    public record ContextDefinition(
            @JsonProperty("type") String type,
            @JsonProperty("node") String node,
            @JsonProperty("label") String label,
            @JsonProperty("title") String title,
            @JsonProperty("capacity") JsonNode capacity,
            @JsonProperty("face") String face,
            @JsonProperty("weight") Long weight,
            @JsonProperty("nodes") JsonNode nodes,
            @JsonProperty("suit") JsonNode suit,
            @JsonProperty("span") SpanDefinition span
    ) {}
}
