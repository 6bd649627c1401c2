/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.List;

/**
 * Addition of rule expressions. Alternative branches coexist structurally.
 */
public record RexSum(List<Rex> terms) implements Rex {

    public RexSum {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("A rule expression sum needs at least one term");
        }
        terms = List.copyOf(terms);
    }
}
