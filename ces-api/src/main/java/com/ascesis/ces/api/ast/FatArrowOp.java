/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

/**
 * Directional operators joining the polynomials of a fat arrow rule.
 */
public enum FatArrowOp {
    FORWARD("=>"),
    BACKWARD("<="),
    BIDIRECTIONAL("<=>");

    private final String symbol;

    FatArrowOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
