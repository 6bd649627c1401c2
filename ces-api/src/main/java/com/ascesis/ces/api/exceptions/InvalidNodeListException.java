/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

/**
 * A position that requires an explicit node list received a polynomial that
 * is not plain (it contains a sum or a parenthesized sub-polynomial).
 */
public class InvalidNodeListException extends CompilationException {

    private final String operand;

    public InvalidNodeListException(String operand) {
        super("Not a node list: " + operand);
        this.operand = operand;
    }

    public String getOperand() {
        return operand;
    }
}
