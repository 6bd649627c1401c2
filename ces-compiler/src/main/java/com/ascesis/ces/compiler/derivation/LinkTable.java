/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.derivation;

import com.ascesis.ces.api.model.LinkKind;
import it.unimi.dsi.fastutil.longs.Long2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2IntMap;

/**
 * Link records keyed by (source id, target id), packed into one long.
 *
 * <p>The value holds side flags: {@link #EFFECT} when the link was specified
 * from the source's effect side, {@link #CAUSE} when specified from the
 * target's cause side. Adding the same pair again ORs the flags, so an
 * effect-only record merged with a cause-only record yields a full link.
 * Insertion order is preserved.
 */
public final class LinkTable {

    public static final int EFFECT = 1;
    public static final int CAUSE = 2;

    private final Long2IntLinkedOpenHashMap flags = new Long2IntLinkedOpenHashMap();

    public LinkTable() {
        flags.defaultReturnValue(0);
    }

    static long key(int source, int target) {
        return ((long) source << 32) | (target & 0xFFFFFFFFL);
    }

    public static int source(long key) {
        return (int) (key >>> 32);
    }

    public static int target(long key) {
        return (int) key;
    }

    public void add(int source, int target, int sideFlags) {
        long key = key(source, target);
        flags.put(key, flags.get(key) | sideFlags);
    }

    public void addAll(LinkTable other) {
        for (Long2IntMap.Entry entry : other.flags.long2IntEntrySet()) {
            long key = entry.getLongKey();
            flags.put(key, flags.get(key) | entry.getIntValue());
        }
    }

    public int flags(int source, int target) {
        return flags.get(key(source, target));
    }

    public LinkKind kind(int source, int target) {
        return toKind(flags(source, target));
    }

    public static LinkKind toKind(int sideFlags) {
        return LinkKind.of((sideFlags & EFFECT) != 0, (sideFlags & CAUSE) != 0);
    }

    public boolean contains(int source, int target) {
        return flags.containsKey(key(source, target));
    }

    public int size() {
        return flags.size();
    }

    public boolean isEmpty() {
        return flags.isEmpty();
    }

    public Iterable<Long2IntMap.Entry> entries() {
        return flags.long2IntEntrySet();
    }

    public LinkTable copy() {
        LinkTable copy = new LinkTable();
        copy.flags.putAll(flags);
        return copy;
    }
}
