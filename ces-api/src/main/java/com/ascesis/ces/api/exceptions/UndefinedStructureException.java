/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

import com.ascesis.ces.api.ast.SourceSpan;

/**
 * An instantiation, or the root selection, names a structure that is not defined in the file.
 */
public class UndefinedStructureException extends CompilationException {

    private final String name;
    private final SourceSpan span;

    public UndefinedStructureException(String name, SourceSpan span) {
        super("Undefined structure: " + name);
        this.name = name;
        this.span = span;
    }

    public String getName() {
        return name;
    }

    public SourceSpan getSpan() {
        return span;
    }
}
