/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.coherence;

import com.ascesis.ces.api.model.CesNode;
import com.ascesis.ces.api.model.Link;
import com.ascesis.ces.api.model.LinkKind;
import com.ascesis.ces.api.model.ResolutionWarning;
import com.ascesis.ces.api.model.Structure;
import com.ascesis.ces.compiler.model.NodeDictionary;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Computes per-node coherence facts and hands the verdict to a {@link CoherencePolicy}.
 *
 * <h2>Dangling nodes</h2>
 * <p>A node is a candidate dangling node when it has at least one incident
 * link but exactly one of its cause and effect polynomials is non-theta.
 * Boundary sources and sinks of open structures are dangling by this
 * definition, which is why the default policy only warns.
 */
public class CoherenceChecker {
    private static final Logger logger = Logger.getLogger(CoherenceChecker.class.getName());

    private final CoherencePolicy policy;

    public CoherenceChecker() {
        this(CoherenceMode.LENIENT.policy());
    }

    public CoherenceChecker(CoherencePolicy policy) {
        this.policy = policy;
    }

    public CoherenceReport analyze(Structure structure) {
        NodeDictionary ids = new NodeDictionary();
        structure.getNodes().forEach(node -> ids.encode(node.id()));

        RoaringBitmap incident = new RoaringBitmap();
        List<Link> partialLinks = new ArrayList<>();
        for (Link link : structure.getLinks()) {
            incident.add(ids.encode(link.source()));
            incident.add(ids.encode(link.target()));
            if (link.kind() != LinkKind.FULL) {
                partialLinks.add(link);
            }
        }

        List<NodeCoherence> nodes = new ArrayList<>();
        List<String> dangling = new ArrayList<>();
        for (CesNode node : structure.getNodes()) {
            NodeCoherence coherence = new NodeCoherence(node.id(), node.cause(), node.effect(),
                    incident.contains(ids.getId(node.id())));
            nodes.add(coherence);
            if (coherence.isDangling()) {
                dangling.add(node.id());
            }
        }
        return new CoherenceReport(nodes, dangling, partialLinks);
    }

    /**
     * Analyzes the structure and applies the policy.
     *
     * @return the warnings the policy attaches to the structure
     * @throws com.ascesis.ces.api.exceptions.IncoherentStructureException if the policy rejects it
     */
    public List<ResolutionWarning> check(Structure structure) {
        CoherenceReport report = analyze(structure);
        if (report.hasDanglingNodes()) {
            logger.warning(() -> "Structure '" + structure.getName() + "' has dangling nodes: "
                    + report.danglingNodes());
        }
        return policy.judge(structure, report);
    }

    public CoherencePolicy getPolicy() {
        return policy;
    }
}
