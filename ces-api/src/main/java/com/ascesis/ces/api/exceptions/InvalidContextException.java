/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

import com.ascesis.ces.api.ast.SourceSpan;

/**
 * A context declaration carries a value the structure cannot hold, e.g. a non-positive weight.
 */
public class InvalidContextException extends CompilationException {

    private final String subject;
    private final SourceSpan span;

    public InvalidContextException(String subject, String detail, SourceSpan span) {
        super("Invalid context declaration for '" + subject + "': " + detail);
        this.subject = subject;
        this.span = span;
    }

    public String getSubject() {
        return subject;
    }

    public SourceSpan getSpan() {
        return span;
    }
}
