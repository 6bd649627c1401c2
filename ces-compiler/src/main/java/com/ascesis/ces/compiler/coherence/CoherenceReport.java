/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.coherence;

import com.ascesis.ces.api.model.Link;

import java.util.List;

/**
 * Result of coherence analysis of one structure.
 *
 * @param nodes         per-node facts, in structure order
 * @param danglingNodes candidate dangling nodes, in structure order
 * @param partialLinks  links that are not {@link com.ascesis.ces.api.model.LinkKind#FULL}
 */
public record CoherenceReport(List<NodeCoherence> nodes, List<String> danglingNodes, List<Link> partialLinks) {

    public CoherenceReport {
        nodes = List.copyOf(nodes);
        danglingNodes = List.copyOf(danglingNodes);
        partialLinks = List.copyOf(partialLinks);
    }

    public boolean hasDanglingNodes() {
        return !danglingNodes.isEmpty();
    }

    public boolean isProper() {
        return partialLinks.isEmpty();
    }
}
