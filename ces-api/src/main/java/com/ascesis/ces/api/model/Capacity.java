/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Capacity of a node: a positive integer or unbounded.
 */
public final class Capacity {

    public static final Capacity DEFAULT = new Capacity(1);
    private static final Capacity UNBOUNDED = new Capacity(-1);

    private final long value;

    private Capacity(long value) {
        this.value = value;
    }

    public static Capacity of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + value);
        }
        return value == 1 ? DEFAULT : new Capacity(value);
    }

    public static Capacity unbounded() {
        return UNBOUNDED;
    }

    public boolean isUnbounded() {
        return value < 0;
    }

    /**
     * @return the finite value, or {@link Long#MAX_VALUE} when unbounded
     */
    public long value() {
        return isUnbounded() ? Long.MAX_VALUE : value;
    }

    @JsonValue
    Object toJson() {
        return isUnbounded() ? "unbounded" : (Object) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Capacity that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isUnbounded() ? "ω" : Long.toString(value);
    }
}
