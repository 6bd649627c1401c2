/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

/**
 * The AST handed over by the front end is structurally malformed.
 */
public class InvalidAstException extends CompilationException {

    public InvalidAstException(String message) {
        super(message);
    }

    public InvalidAstException(String message, Throwable cause) {
        super(message, cause);
    }
}
