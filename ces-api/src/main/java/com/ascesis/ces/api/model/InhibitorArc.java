/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

import com.ascesis.ces.api.ast.Face;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An inhibitor arc, layered over (never replacing) ordinary links.
 */
public record InhibitorArc(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("face") Face face
) {
}
