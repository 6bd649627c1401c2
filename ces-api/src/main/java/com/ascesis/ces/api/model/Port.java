/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A (node, polarity) pair generated by a rule.
 */
public record Port(
        @JsonProperty("node") String node,
        @JsonProperty("polarity") Polarity polarity
) {
    public static Port send(String node) {
        return new Port(node, Polarity.SEND);
    }

    public static Port receive(String node) {
        return new Port(node, Polarity.RECEIVE);
    }

    @Override
    public String toString() {
        return (polarity == Polarity.SEND ? ">" : "<") + node;
    }
}
