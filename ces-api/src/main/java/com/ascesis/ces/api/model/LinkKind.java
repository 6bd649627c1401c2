/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

/**
 * Which side of a link was specified: only the source's effects, only the
 * target's causes, or both.
 */
public enum LinkKind {
    EFFECT_ONLY,
    CAUSE_ONLY,
    FULL;

    public static LinkKind of(boolean effectSide, boolean causeSide) {
        if (effectSide && causeSide) {
            return FULL;
        }
        if (effectSide) {
            return EFFECT_ONLY;
        }
        if (causeSide) {
            return CAUSE_ONLY;
        }
        throw new IllegalArgumentException("A link needs at least one specified side");
    }

    public boolean hasEffectSide() {
        return this != CAUSE_ONLY;
    }

    public boolean hasCauseSide() {
        return this != EFFECT_ONLY;
    }

    public LinkKind merge(LinkKind other) {
        return of(hasEffectSide() || other.hasEffectSide(), hasCauseSide() || other.hasCauseSide());
    }
}
