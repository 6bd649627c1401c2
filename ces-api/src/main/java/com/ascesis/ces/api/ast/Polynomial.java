/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import com.ascesis.ces.api.exceptions.InvalidNodeListException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * A sum of monomials over node identifiers.
 *
 * <p>Each monomial is an ordered product of node occurrences; repeated
 * occurrences are kept because they carry multiplicity. Addition and
 * multiplication are structural: {@link #add} concatenates monomial lists
 * without deduplication, {@link #multiply} distributes and concatenates
 * occurrence sequences (this polynomial's occurrences first).
 *
 * <h2>Plainness</h2>
 * <p>The same surface production is used for general polynomials and for
 * node lists. A polynomial is <em>plain</em> iff it was built only by
 * juxtaposing identifiers: the result of {@link #add} is never plain, nor is
 * a {@link #parenthesized()} copy, and a product is plain only if both
 * factors are. Positions that require a node list call {@link #toNodeList()}.
 *
 * <h2>Equality</h2>
 * <p>{@link #equals} is structural: the same monomials in the same order with
 * the same factor order, and the same plain flag. {@link #isEquivalentTo}
 * compares the multisets of monomials instead, each monomial taken as a
 * multiset of occurrences.
 */
public final class Polynomial {

    private static final Comparator<List<String>> MONOMIAL_ORDER = (a, b) -> {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    private static final Polynomial THETA = new Polynomial(List.of(), true);

    private final List<List<String>> monomials;
    private final boolean plain;
    private final List<List<String>> canonical;

    private Polynomial(List<List<String>> monomials, boolean plain) {
        this.monomials = monomials;
        this.plain = plain;
        this.canonical = canonize(monomials);
    }

    /**
     * The empty polynomial (no monomials).
     */
    public static Polynomial theta() {
        return THETA;
    }

    /**
     * A single identifier.
     */
    public static Polynomial of(String node) {
        Objects.requireNonNull(node, "Node identifier cannot be null");
        return new Polynomial(List.of(List.of(node)), true);
    }

    /**
     * Juxtaposition of identifiers, e.g. {@code a b c}. The result is plain.
     */
    public static Polynomial product(String... nodes) {
        if (nodes.length == 0) {
            return THETA;
        }
        return new Polynomial(List.of(List.of(nodes)), true);
    }

    /**
     * Sum of single identifiers, e.g. {@code a + b + c}.
     */
    public static Polynomial sum(String... nodes) {
        Polynomial result = THETA;
        for (String node : nodes) {
            result = result.add(of(node));
        }
        return result;
    }

    /**
     * Concatenates the monomials of both operands. Adding theta returns the
     * other operand unchanged.
     */
    public Polynomial add(Polynomial other) {
        if (other.isTheta()) {
            return this;
        }
        if (isTheta()) {
            return other;
        }
        List<List<String>> result = new ArrayList<>(monomials.size() + other.monomials.size());
        result.addAll(monomials);
        result.addAll(other.monomials);
        return new Polynomial(List.copyOf(result), false);
    }

    public Polynomial multiply(Polynomial other) {
        List<List<String>> result = new ArrayList<>(monomials.size() * other.monomials.size());
        for (List<String> left : monomials) {
            for (List<String> right : other.monomials) {
                List<String> mono = new ArrayList<>(left.size() + right.size());
                mono.addAll(left);
                mono.addAll(right);
                result.add(List.copyOf(mono));
            }
        }
        if (result.isEmpty()) {
            return THETA;
        }
        return new Polynomial(List.copyOf(result), plain && other.plain);
    }

    /**
     * The same polynomial as written inside parentheses; never plain.
     */
    public Polynomial parenthesized() {
        return plain ? new Polynomial(monomials, false) : this;
    }

    /**
     * Renames every node occurrence, keeping structure and plainness.
     */
    public Polynomial rename(UnaryOperator<String> renaming) {
        List<List<String>> result = monomials.stream()
                .map(mono -> mono.stream().map(renaming).collect(Collectors.toUnmodifiableList()))
                .collect(Collectors.toUnmodifiableList());
        return new Polynomial(result, plain);
    }

    public boolean isPlain() {
        return plain;
    }

    public boolean isTheta() {
        return monomials.isEmpty();
    }

    public List<List<String>> monomials() {
        return monomials;
    }

    public int size() {
        return monomials.size();
    }

    /**
     * Distinct nodes mentioned anywhere in this polynomial, in order of first occurrence.
     */
    public Set<String> nodes() {
        Set<String> nodes = new LinkedHashSet<>();
        monomials.forEach(nodes::addAll);
        return nodes;
    }

    /**
     * Flattens every mentioned node into a node list, regardless of plainness.
     */
    public NodeList flatten() {
        return NodeList.of(nodes());
    }

    /**
     * Reads this polynomial as an explicit node list.
     *
     * @throws InvalidNodeListException if the polynomial is not plain
     */
    public NodeList toNodeList() {
        if (!plain || monomials.size() > 1) {
            throw new InvalidNodeListException(toString());
        }
        return isTheta() ? NodeList.empty() : NodeList.of(monomials.get(0));
    }

    private static List<List<String>> canonize(List<List<String>> monomials) {
        List<List<String>> result = new ArrayList<>(monomials.size());
        for (List<String> mono : monomials) {
            List<String> sorted = new ArrayList<>(mono);
            sorted.sort(null);
            result.add(sorted);
        }
        result.sort(MONOMIAL_ORDER);
        return result;
    }

    /**
     * Equality up to monomial order and factor order, ignoring plainness.
     */
    public boolean isEquivalentTo(Polynomial other) {
        return this == other || canonical.equals(other.canonical);
    }

    @JsonValue
    List<List<String>> toJson() {
        return monomials;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polynomial that)) return false;
        return plain == that.plain && monomials.equals(that.monomials);
    }

    @Override
    public int hashCode() {
        return 31 * monomials.hashCode() + Boolean.hashCode(plain);
    }

    @Override
    public String toString() {
        if (monomials.isEmpty()) {
            return "θ";
        }
        return monomials.stream()
                .map(mono -> String.join(" ", mono))
                .collect(Collectors.joining(" + "));
    }
}
