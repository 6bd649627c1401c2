/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

import com.ascesis.ces.api.ast.Polynomial;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A node of a resolved structure with its accumulated cause and effect polynomials.
 */
public record CesNode(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("capacity") Capacity capacity,
        @JsonProperty("cause") Polynomial cause,
        @JsonProperty("effect") Polynomial effect
) {
}
