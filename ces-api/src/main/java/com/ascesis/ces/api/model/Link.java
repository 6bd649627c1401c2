/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A directed, weighted relation from a send port to a receive port.
 */
public record Link(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("kind") LinkKind kind,
        @JsonProperty("weight") long weight
) implements Serializable {

    public static final long DEFAULT_WEIGHT = 1L;

    public Link(String source, String target, LinkKind kind) {
        this(source, target, kind, DEFAULT_WEIGHT);
    }

    @JsonIgnore
    public Port sendPort() {
        return Port.send(source);
    }

    @JsonIgnore
    public Port receivePort() {
        return Port.receive(target);
    }

    @JsonIgnore
    public boolean isFull() {
        return kind == LinkKind.FULL;
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
