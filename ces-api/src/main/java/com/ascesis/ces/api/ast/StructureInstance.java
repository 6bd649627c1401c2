/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A reference to a structure definition: the immediate form {@code K()} or the
 * template form {@code K!(args...)}.
 */
public record StructureInstance(String name, boolean templated, List<Argument> args, SourceSpan span)
        implements Rex {

    public StructureInstance {
        Objects.requireNonNull(name, "Structure name cannot be null");
        args = args == null ? List.of() : List.copyOf(args);
        span = span == null ? SourceSpan.UNKNOWN : span;
    }

    public static StructureInstance immediate(String name) {
        return new StructureInstance(name, false, List.of(), SourceSpan.UNKNOWN);
    }

    public static StructureInstance template(String name, Argument... args) {
        return new StructureInstance(name, true, List.of(args), SourceSpan.UNKNOWN);
    }

    @Override
    public String toString() {
        if (!templated) {
            return name + "()";
        }
        return name + "!(" + args.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
