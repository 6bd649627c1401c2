/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.derivation;

import com.ascesis.ces.api.ast.Polynomial;
import com.ascesis.ces.api.ast.ThinArrowRule;
import com.ascesis.ces.compiler.model.Fragment;
import com.ascesis.ces.compiler.model.NodeDictionary;
import org.roaringbitmap.RoaringBitmap;

import java.util.LinkedHashMap;

/**
 * Turns a thin arrow rule into ports, links and per-node polynomials.
 *
 * <p>For a rule with node list N, cause C and effect E:
 * <ul>
 *   <li>{@code T}, {@code R}: send and receive ports of N</li>
 *   <li>{@code T'}: send ports of C; {@code R'}: receive ports of E</li>
 *   <li>effect side {@code A = T×R'}, cause side {@code B = T'×R}</li>
 * </ul>
 * Links in {@code A\B} are effect-only, in {@code B\A} cause-only and in
 * {@code A∩B} full. A one-sided rule is the special case where one of the
 * products is empty. The number of links is bounded by {@code |T|×|R'| + |T'|×|R|}.
 */
public class PortLinkDeriver {

    public Fragment derive(ThinArrowRule rule, NodeDictionary dictionary) {
        LinkedHashMap<String, Fragment.Sides> nodes = new LinkedHashMap<>();

        RoaringBitmap nodePorts = new RoaringBitmap();
        for (String node : rule.nodes().nodes()) {
            nodePorts.add(dictionary.encode(node));
            nodes.put(node, new Fragment.Sides(rule.cause(), rule.effect()));
        }
        RoaringBitmap causeSenders = ports(rule.cause(), dictionary, nodes);
        RoaringBitmap effectReceivers = ports(rule.effect(), dictionary, nodes);

        LinkTable links = new LinkTable();
        cross(nodePorts, effectReceivers, LinkTable.EFFECT, links);
        cross(causeSenders, nodePorts, LinkTable.CAUSE, links);
        return Fragment.of(dictionary, nodes, links);
    }

    private static RoaringBitmap ports(Polynomial polynomial, NodeDictionary dictionary,
                                       LinkedHashMap<String, Fragment.Sides> nodes) {
        RoaringBitmap ports = new RoaringBitmap();
        for (String node : polynomial.nodes()) {
            ports.add(dictionary.encode(node));
            nodes.putIfAbsent(node, Fragment.Sides.EMPTY);
        }
        return ports;
    }

    private static void cross(RoaringBitmap senders, RoaringBitmap receivers, int side, LinkTable links) {
        if (senders.isEmpty() || receivers.isEmpty()) {
            return;
        }
        int[] targets = receivers.toArray();
        for (int source : senders.toArray()) {
            for (int target : targets) {
                links.add(source, target, side);
            }
        }
    }
}
