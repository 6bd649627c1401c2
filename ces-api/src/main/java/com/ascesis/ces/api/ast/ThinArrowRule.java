/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.Objects;

/**
 * A rule specifying the cause and/or effect polynomial of an explicit node list.
 * Every shape normalizes to the (nodes, cause, effect) triple; an absent side is theta.
 */
public record ThinArrowRule(ThinArrowShape shape, NodeList nodes, Polynomial cause, Polynomial effect)
        implements Rex {

    public ThinArrowRule {
        Objects.requireNonNull(shape, "Shape cannot be null");
        Objects.requireNonNull(nodes, "Node list cannot be null");
        cause = cause == null ? Polynomial.theta() : cause;
        effect = effect == null ? Polynomial.theta() : effect;
    }

    public static ThinArrowRule effectOnly(Polynomial nodes, Polynomial effect) {
        return new ThinArrowRule(ThinArrowShape.EFFECT_ONLY, nodes.toNodeList(), null, effect);
    }

    public static ThinArrowRule causeOnly(Polynomial nodes, Polynomial cause) {
        return new ThinArrowRule(ThinArrowShape.CAUSE_ONLY, nodes.toNodeList(), cause, null);
    }

    public static ThinArrowRule causeThenEffect(Polynomial nodes, Polynomial cause, Polynomial effect) {
        return new ThinArrowRule(ThinArrowShape.CAUSE_THEN_EFFECT, nodes.toNodeList(), cause, effect);
    }

    public static ThinArrowRule effectThenCause(Polynomial nodes, Polynomial effect, Polynomial cause) {
        return new ThinArrowRule(ThinArrowShape.EFFECT_THEN_CAUSE, nodes.toNodeList(), cause, effect);
    }

    public static ThinArrowRule forward(Polynomial cause, Polynomial nodes, Polynomial effect) {
        return new ThinArrowRule(ThinArrowShape.FORWARD, nodes.toNodeList(), cause, effect);
    }

    public static ThinArrowRule backward(Polynomial effect, Polynomial nodes, Polynomial cause) {
        return new ThinArrowRule(ThinArrowShape.BACKWARD, nodes.toNodeList(), cause, effect);
    }

    /**
     * Builds a rule from already normalized parts, picking the shape from the non-theta sides.
     */
    public static ThinArrowRule of(NodeList nodes, Polynomial cause, Polynomial effect) {
        ThinArrowShape shape;
        if (cause.isTheta()) {
            shape = ThinArrowShape.EFFECT_ONLY;
        } else if (effect.isTheta()) {
            shape = ThinArrowShape.CAUSE_ONLY;
        } else {
            shape = ThinArrowShape.FORWARD;
        }
        return new ThinArrowRule(shape, nodes, cause, effect);
    }

    public boolean hasCause() {
        return !cause.isTheta();
    }

    public boolean hasEffect() {
        return !effect.isTheta();
    }

    public boolean isTwoSided() {
        return hasCause() && hasEffect();
    }

    @Override
    public String toString() {
        return switch (shape) {
            case EFFECT_ONLY -> nodes + " -> " + effect;
            case CAUSE_ONLY -> nodes + " <- " + cause;
            case CAUSE_THEN_EFFECT -> nodes + " <- " + cause + " -> " + effect;
            case EFFECT_THEN_CAUSE -> nodes + " -> " + effect + " <- " + cause;
            case FORWARD -> cause + " -> " + nodes + " -> " + effect;
            case BACKWARD -> effect + " <- " + nodes + " <- " + cause;
        };
    }
}
