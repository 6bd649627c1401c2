/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.List;

/**
 * Implicit multiplication (juxtaposition) of rule expressions.
 */
public record RexProduct(List<Rex> factors) implements Rex {

    public RexProduct {
        if (factors == null || factors.isEmpty()) {
            throw new IllegalArgumentException("A rule expression product needs at least one factor");
        }
        factors = List.copyOf(factors);
    }
}
