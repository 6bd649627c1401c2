/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.exceptions;

import java.util.List;

/**
 * A structure instantiates itself, directly or transitively.
 */
public class CyclicInstantiationException extends CompilationException {

    private final List<String> cycle;

    /**
     * @param cycle the instantiation path, starting and ending with the repeated structure
     */
    public CyclicInstantiationException(List<String> cycle) {
        super("Cyclic instantiation: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }

    public String getStructureName() {
        return cycle.get(0);
    }
}
