/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

/**
 * Character offsets of an AST element in its source text, as reported by the front end.
 * Errors carry spans so that an external layer can point back into the source.
 */
public record SourceSpan(int start, int end) {

    public static final SourceSpan UNKNOWN = new SourceSpan(-1, -1);

    public boolean isKnown() {
        return start >= 0;
    }

    @Override
    public String toString() {
        return isKnown() ? start + ".." + end : "?";
    }
}
