/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A chain {@code P0 op1 P1 ... opk Pk} of at least two polynomials.
 */
public record FatArrowRule(Polynomial head, List<Step> steps) implements Rex {

    public record Step(FatArrowOp op, Polynomial target) {
        public Step {
            Objects.requireNonNull(op, "Operator cannot be null");
            Objects.requireNonNull(target, "Polynomial cannot be null");
        }
    }

    public FatArrowRule {
        Objects.requireNonNull(head, "Head polynomial cannot be null");
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Single-polynomial fat arrow rule");
        }
        steps = List.copyOf(steps);
    }

    public static FatArrowRule forward(Polynomial cause, Polynomial effect) {
        return new FatArrowRule(cause, List.of(new Step(FatArrowOp.FORWARD, effect)));
    }

    public static FatArrowRule backward(Polynomial effect, Polynomial cause) {
        return new FatArrowRule(effect, List.of(new Step(FatArrowOp.BACKWARD, cause)));
    }

    public static FatArrowRule bidirectional(Polynomial left, Polynomial right) {
        return new FatArrowRule(left, List.of(new Step(FatArrowOp.BIDIRECTIONAL, right)));
    }

    public static Builder startingAt(Polynomial head) {
        return new Builder(head);
    }

    /**
     * All polynomials of the chain, head first.
     */
    public List<Polynomial> polynomials() {
        List<Polynomial> result = new ArrayList<>(steps.size() + 1);
        result.add(head);
        steps.forEach(step -> result.add(step.target()));
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(head.toString());
        for (Step step : steps) {
            sb.append(' ').append(step.op().symbol()).append(' ').append(step.target());
        }
        return sb.toString();
    }

    public static final class Builder {
        private final Polynomial head;
        private final List<Step> steps = new ArrayList<>();

        private Builder(Polynomial head) {
            this.head = head;
        }

        public Builder then(FatArrowOp op, Polynomial target) {
            steps.add(new Step(op, target));
            return this;
        }

        public FatArrowRule build() {
            return new FatArrowRule(head, steps);
        }
    }
}
