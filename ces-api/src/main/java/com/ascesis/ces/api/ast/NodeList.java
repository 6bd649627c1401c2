/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * An alphabetically ordered, duplicate-free list of node identifiers.
 */
public final class NodeList {

    private static final NodeList EMPTY = new NodeList(List.of());

    private final List<String> nodes;

    private NodeList(List<String> nodes) {
        this.nodes = nodes;
    }

    public static NodeList empty() {
        return EMPTY;
    }

    public static NodeList of(String... nodes) {
        return of(List.of(nodes));
    }

    public static NodeList of(Collection<String> nodes) {
        return new NodeList(List.copyOf(new TreeSet<>(nodes)));
    }

    public NodeList union(NodeList other) {
        TreeSet<String> merged = new TreeSet<>(nodes);
        merged.addAll(other.nodes);
        return new NodeList(List.copyOf(merged));
    }

    public NodeList rename(UnaryOperator<String> renaming) {
        TreeSet<String> renamed = new TreeSet<>();
        nodes.forEach(node -> renamed.add(renaming.apply(node)));
        return new NodeList(List.copyOf(renamed));
    }

    public boolean contains(String node) {
        return nodes.contains(node);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    @JsonValue
    public List<String> nodes() {
        return nodes;
    }

    /**
     * This list as a plain polynomial (a single product of its nodes).
     */
    public Polynomial asPolynomial() {
        return Polynomial.product(nodes.toArray(new String[0]));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeList that)) return false;
        return nodes.equals(that.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", nodes);
    }
}
