/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.coherence;

import com.ascesis.ces.api.ast.Polynomial;

/**
 * Coherence facts about one node.
 *
 * @param incident whether at least one link starts or ends at the node
 */
public record NodeCoherence(String node, Polynomial cause, Polynomial effect, boolean incident) {

    /**
     * A node with incident links and exactly one of its polynomials non-theta.
     */
    public boolean isDangling() {
        return incident && (cause.isTheta() != effect.isTheta());
    }
}
