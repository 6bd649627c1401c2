/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

public enum WarningKind {
    /** A node with incident links has exactly one of its cause and effect polynomials non-empty. */
    INCOHERENT_NODE,
    /** A context declaration names a node absent from the structure. */
    UNKNOWN_NODE,
    /** A multiplier declaration names a link absent from the structure. */
    UNKNOWN_LINK,
    /** A later context declaration replaced an earlier one for the same key. */
    OVERRIDDEN_DECLARATION
}
