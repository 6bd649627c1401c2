/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

/**
 * The fat-into-thin simplification loop did not reach a fixed point within its iteration bound.
 */
public class FitDivergenceException extends CompilationException {

    private final int iterations;

    public FitDivergenceException(String rule, int iterations) {
        super("Fat arrow rule '" + rule + "' did not reach a fixed point after " + iterations + " iterations");
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
