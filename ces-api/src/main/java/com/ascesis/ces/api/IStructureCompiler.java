/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api;

import com.ascesis.ces.api.ast.CesFile;
import com.ascesis.ces.api.model.Structure;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for resolving c-e structure definitions into a flat structure.
 */
public interface IStructureCompiler {

    /**
     * Loads an AST document from a JSON file and resolves its root structure.
     *
     * @throws IOException if the file cannot be read
     * @throws com.ascesis.ces.api.exceptions.CompilationException if resolution fails
     */
    Structure compile(Path path) throws IOException;

    /**
     * Resolves the root structure of an already parsed file.
     *
     * @throws com.ascesis.ces.api.exceptions.CompilationException if resolution fails
     */
    Structure resolve(CesFile file);

    default void setTracer(Tracer tracer) {
    }

    default void setCompilationListener(CompilationListener listener) {
    }
}
