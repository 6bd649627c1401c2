/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

import com.ascesis.ces.api.ast.SourceSpan;

/**
 * Two structure definitions in one file share a name.
 */
public class DuplicateNameException extends CompilationException {

    private final String name;
    private final SourceSpan firstSpan;
    private final SourceSpan duplicateSpan;

    public DuplicateNameException(String name, SourceSpan firstSpan, SourceSpan duplicateSpan) {
        super("Duplicate structure name: " + name);
        this.name = name;
        this.firstSpan = firstSpan;
        this.duplicateSpan = duplicateSpan;
    }

    public String getName() {
        return name;
    }

    public SourceSpan getFirstSpan() {
        return firstSpan;
    }

    public SourceSpan getDuplicateSpan() {
        return duplicateSpan;
    }
}
