/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.model;

import com.ascesis.ces.api.ast.Polynomial;
import com.ascesis.ces.api.model.Capacity;
import com.ascesis.ces.api.model.CesNode;
import com.ascesis.ces.api.model.Link;
import com.ascesis.ces.api.model.Structure;
import com.ascesis.ces.compiler.derivation.LinkTable;
import it.unimi.dsi.fastutil.longs.Long2IntMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * The partial structure contributed by one rule expression: per-node cause
 * and effect polynomials plus link records.
 *
 * <p>Fragments are values. {@link #sum} and {@link #product} build new
 * fragments and leave their operands untouched.
 */
public final class Fragment {

    /**
     * Cause and effect polynomials accumulated for one node.
     */
    public record Sides(Polynomial cause, Polynomial effect) {
        public static final Sides EMPTY = new Sides(Polynomial.theta(), Polynomial.theta());

        public Sides {
            Objects.requireNonNull(cause, "Cause cannot be null");
            Objects.requireNonNull(effect, "Effect cannot be null");
        }
    }

    private final NodeDictionary dictionary;
    private final Map<String, Sides> nodes;
    private final LinkTable links;

    private Fragment(NodeDictionary dictionary, Map<String, Sides> nodes, LinkTable links) {
        this.dictionary = dictionary;
        this.nodes = nodes;
        this.links = links;
    }

    public static Fragment empty(NodeDictionary dictionary) {
        return new Fragment(dictionary, new LinkedHashMap<>(), new LinkTable());
    }

    /**
     * Builds a fragment from freshly derived parts. The caller hands over ownership of both arguments.
     */
    public static Fragment of(NodeDictionary dictionary, LinkedHashMap<String, Sides> nodes, LinkTable links) {
        return new Fragment(dictionary, nodes, links);
    }

    /**
     * Alternative composition: links are unioned, polynomials added.
     */
    public Fragment sum(Fragment other) {
        return combine(other, Polynomial::add);
    }

    /**
     * Joint composition: links are unioned; a node present on both sides gets
     * the product of its polynomials, except that a theta side is taken from
     * the other operand unchanged.
     */
    public Fragment product(Fragment other) {
        return combine(other, (left, right) -> {
            if (left.isTheta()) {
                return right;
            }
            if (right.isTheta()) {
                return left;
            }
            return left.multiply(right);
        });
    }

    private Fragment combine(Fragment other, BinaryOperator<Polynomial> op) {
        checkSameDictionary(other);
        LinkedHashMap<String, Sides> merged = new LinkedHashMap<>(nodes);
        other.nodes.forEach((node, sides) -> merged.merge(node, sides,
                (mine, theirs) -> new Sides(op.apply(mine.cause(), theirs.cause()),
                        op.apply(mine.effect(), theirs.effect()))));
        LinkTable mergedLinks = links.copy();
        mergedLinks.addAll(other.links);
        return new Fragment(dictionary, merged, mergedLinks);
    }

    private void checkSameDictionary(Fragment other) {
        if (dictionary != other.dictionary) {
            throw new IllegalArgumentException("Fragments from different resolutions cannot be combined");
        }
    }

    public Map<String, Sides> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public Sides sidesOf(String node) {
        return nodes.getOrDefault(node, Sides.EMPTY);
    }

    public LinkTable links() {
        return links;
    }

    public NodeDictionary dictionary() {
        return dictionary;
    }

    /**
     * Materializes this fragment as a structure with default labels,
     * capacities and weights.
     */
    public Structure.Builder toStructure(String name) {
        Structure.Builder builder = Structure.builder(name);
        nodes.forEach((node, sides) ->
                builder.node(new CesNode(node, node, Capacity.DEFAULT, sides.cause(), sides.effect())));
        for (Long2IntMap.Entry entry : links.entries()) {
            long key = entry.getLongKey();
            builder.link(new Link(
                    dictionary.decode(LinkTable.source(key)),
                    dictionary.decode(LinkTable.target(key)),
                    LinkTable.toKind(entry.getIntValue())));
        }
        return builder;
    }
}
