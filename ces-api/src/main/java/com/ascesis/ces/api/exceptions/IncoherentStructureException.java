/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

import java.util.List;

/**
 * The resolved root structure was rejected by the configured coherence policy.
 */
public class IncoherentStructureException extends CompilationException {

    private final String structureName;
    private final List<String> offenders;

    public IncoherentStructureException(String structureName, String detail, List<String> offenders) {
        super("Structure '" + structureName + "' is incoherent: " + detail + " " + offenders);
        this.structureName = structureName;
        this.offenders = List.copyOf(offenders);
    }

    public String getStructureName() {
        return structureName;
    }

    /**
     * Offending nodes, or links rendered as {@code source->target}.
     */
    public List<String> getOffenders() {
        return offenders;
    }
}
