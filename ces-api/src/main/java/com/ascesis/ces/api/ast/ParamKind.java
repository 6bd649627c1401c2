/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

/**
 * Kinds of template parameters.
 *
 * <p>{@link #SIZE} and {@link #NAME} parameters are accepted so that template
 * signatures of the surface grammar load and are checked for arity and kind,
 * but no body construct consumes them: a body that uses one as a node or as
 * a structure fails with an arity or type mismatch.
 */
public enum ParamKind {
    /** A node identifier substituted into polynomials and node lists. */
    NODE,
    /** The name of another structure, substituted into instantiations. */
    STRUCTURE,
    /** A positive integer. Checked at instantiation, not substituted. */
    SIZE,
    /** A literal name. Checked at instantiation, not substituted. */
    NAME
}
