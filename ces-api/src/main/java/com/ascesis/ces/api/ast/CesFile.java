/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import java.util.List;
import java.util.Objects;

/**
 * One parsed source file: structure definitions plus context declarations.
 * Immutable and compared by value.
 */
public record CesFile(String origin, List<StructureDef> structures, List<ContextDeclaration> context) {

    public CesFile {
        origin = origin == null ? "<anonymous>" : origin;
        structures = structures == null ? List.of() : List.copyOf(structures);
        context = context == null ? List.of() : List.copyOf(context);
    }

    public static CesFile of(StructureDef... structures) {
        return new CesFile(null, List.of(structures), List.of());
    }

    public CesFile withContext(ContextDeclaration... declarations) {
        return new CesFile(origin, structures, List.of(declarations));
    }

    public CesFile withOrigin(String newOrigin) {
        return new CesFile(Objects.requireNonNull(newOrigin), structures, context);
    }
}
