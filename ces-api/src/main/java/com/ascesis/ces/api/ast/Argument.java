/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.Objects;

/**
 * An actual argument of a template instantiation.
 */
public interface Argument {

    ParamKind kind();

    static Argument node(String node) {
        return new NodeArg(node);
    }

    static Argument structure(String name) {
        return new StructureArg(name);
    }

    static Argument size(long size) {
        return new SizeArg(size);
    }

    static Argument name(String name) {
        return new NameArg(name);
    }

    record NodeArg(String node) implements Argument {
        public NodeArg {
            Objects.requireNonNull(node, "Node argument cannot be null");
        }

        @Override
        public ParamKind kind() {
            return ParamKind.NODE;
        }

        @Override
        public String toString() {
            return node;
        }
    }

    record StructureArg(String name) implements Argument {
        public StructureArg {
            Objects.requireNonNull(name, "Structure argument cannot be null");
        }

        @Override
        public ParamKind kind() {
            return ParamKind.STRUCTURE;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record SizeArg(long size) implements Argument {
        public SizeArg {
            if (size <= 0) {
                throw new IllegalArgumentException("Size argument must be positive, got: " + size);
            }
        }

        @Override
        public ParamKind kind() {
            return ParamKind.SIZE;
        }

        @Override
        public String toString() {
            return Long.toString(size);
        }
    }

    record NameArg(String name) implements Argument {
        public NameArg {
            Objects.requireNonNull(name, "Name argument cannot be null");
        }

        @Override
        public ParamKind kind() {
            return ParamKind.NAME;
        }

        @Override
        public String toString() {
            return '"' + name + '"';
        }
    }
}
