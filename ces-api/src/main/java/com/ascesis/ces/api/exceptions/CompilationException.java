/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base type of every static semantic error raised while resolving a
 * cause-effect structure file.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the resolution pipeline. As the error propagates out of nested
 * structure instantiations, each enclosing structure adds itself as a frame,
 * so the instantiation trace reads innermost first.
 */
public class CompilationException extends RuntimeException {

    private final List<String> instantiationTrace = new ArrayList<>();

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    public CompilationException(Throwable cause) {
        super(cause);
    }

    /**
     * Records that this error aborted the resolution of the named structure.
     */
    public CompilationException addFrame(String structureName) {
        instantiationTrace.add(structureName);
        return this;
    }

    /**
     * Names of the structures whose resolution this error aborted, innermost first.
     */
    public List<String> getInstantiationTrace() {
        return Collections.unmodifiableList(instantiationTrace);
    }

    /**
     * The message without the instantiation trace.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (instantiationTrace.isEmpty()) {
            return super.getMessage();
        }
        return super.getMessage() + " (while resolving " + String.join(" <- ", instantiationTrace) + ")";
    }
}
