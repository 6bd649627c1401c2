/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

import com.ascesis.ces.api.ast.SourceSpan;

/**
 * A structure instantiation does not match the declared parameter list of its
 * definition: wrong argument count, wrong argument kind, or the immediate form
 * used for a template (and vice versa).
 */
public class ArityOrTypeMismatchException extends CompilationException {

    private final String structureName;
    private final SourceSpan span;

    public ArityOrTypeMismatchException(String structureName, String detail, SourceSpan span) {
        super("Structure '" + structureName + "': " + detail);
        this.structureName = structureName;
        this.span = span;
    }

    public String getStructureName() {
        return structureName;
    }

    public SourceSpan getSpan() {
        return span;
    }
}
