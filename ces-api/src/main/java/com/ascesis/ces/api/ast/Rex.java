/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.List;

/**
 * A rule expression: thin and fat arrow rules, structure instances, and their
 * sums (alternatives) and products (joint composition).
 */
public interface Rex {

    static Rex sum(Rex... terms) {
        return terms.length == 1 ? terms[0] : new RexSum(List.of(terms));
    }

    static Rex product(Rex... factors) {
        return factors.length == 1 ? factors[0] : new RexProduct(List.of(factors));
    }
}
