/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Interns node identifiers to dense integer ids.
 *
 * <p>Ids are assigned in order of first mention, so iterating ids in
 * ascending order reproduces the source order of nodes. One dictionary is
 * created per file resolution and never shared across resolutions.
 */
public class NodeDictionary {

    private final Object2IntMap<String> nameToId = new Object2IntOpenHashMap<>();
    private final List<String> idToName = new ArrayList<>();

    public NodeDictionary() {
        nameToId.defaultReturnValue(-1);
    }

    /**
     * Returns the id of the node, assigning the next free id on first mention.
     */
    public int encode(String node) {
        return nameToId.computeIfAbsent(node, (String s) -> {
            int id = idToName.size();
            idToName.add(s);
            return id;
        });
    }

    /**
     * @return the node name, or {@code null} for an unknown id
     */
    public String decode(int id) {
        if (id >= 0 && id < idToName.size()) {
            return idToName.get(id);
        }
        return null;
    }

    /**
     * @return the id, or -1 if the node was never encoded
     */
    public int getId(String node) {
        return nameToId.getInt(node);
    }

    public int size() {
        return idToName.size();
    }
}
