/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.coherence;

import com.ascesis.ces.api.exceptions.IncoherentStructureException;
import com.ascesis.ces.api.model.Link;
import com.ascesis.ces.api.model.ResolutionWarning;
import com.ascesis.ces.api.model.WarningKind;

import java.util.List;
import java.util.Locale;

/**
 * Built-in coherence policies.
 */
public enum CoherenceMode {

    /** Accept every structure; dangling nodes become warnings. */
    LENIENT,

    /** Reject structures with dangling nodes. */
    STRICT,

    /** Reject structures with any link that is not full. */
    PROPER;

    public CoherencePolicy policy() {
        return switch (this) {
            case LENIENT -> (structure, report) -> report.danglingNodes().stream()
                    .map(node -> new ResolutionWarning(WarningKind.INCOHERENT_NODE, node,
                            "Node has incident links but only one of cause and effect is specified"))
                    .toList();
            case STRICT -> (structure, report) -> {
                if (report.hasDanglingNodes()) {
                    throw new IncoherentStructureException(structure.getName(),
                            "dangling nodes", report.danglingNodes());
                }
                return List.of();
            };
            case PROPER -> (structure, report) -> {
                if (!report.isProper()) {
                    throw new IncoherentStructureException(structure.getName(),
                            "links without both sides specified",
                            report.partialLinks().stream().map(Link::toString).toList());
                }
                return List.of();
            };
        };
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for an unknown mode name
     */
    public static CoherenceMode fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
