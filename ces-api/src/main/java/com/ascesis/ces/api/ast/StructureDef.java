/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.List;
import java.util.Objects;

/**
 * A named structure definition, immediate ({@code ces K { ... }}) or templated
 * ({@code ces K(x: Node, ...) { ... }}).
 */
public record StructureDef(String name, List<TemplateParam> params, Rex body, SourceSpan span) {

    public StructureDef {
        Objects.requireNonNull(name, "Structure name cannot be null");
        Objects.requireNonNull(body, "Structure body cannot be null");
        params = params == null ? List.of() : List.copyOf(params);
        span = span == null ? SourceSpan.UNKNOWN : span;
    }

    public static StructureDef immediate(String name, Rex body) {
        return new StructureDef(name, List.of(), body, SourceSpan.UNKNOWN);
    }

    public static StructureDef template(String name, List<TemplateParam> params, Rex body) {
        return new StructureDef(name, params, body, SourceSpan.UNKNOWN);
    }

    public boolean isTemplate() {
        return !params.isEmpty();
    }
}
