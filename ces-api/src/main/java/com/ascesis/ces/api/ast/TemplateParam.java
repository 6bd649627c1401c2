/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.Objects;

public record TemplateParam(String name, ParamKind kind) {

    public TemplateParam {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        Objects.requireNonNull(kind, "Parameter kind cannot be null");
    }

    @Override
    public String toString() {
        return name + ": " + kind;
    }
}
