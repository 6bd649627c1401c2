/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.registry;

import com.ascesis.ces.api.ast.SourceSpan;
import com.ascesis.ces.api.ast.StructureDef;
import com.ascesis.ces.api.exceptions.DuplicateNameException;
import com.ascesis.ces.api.exceptions.UndefinedStructureException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name to definition map of one file.
 */
public final class StructureRegistry {

    private final Map<String, StructureDef> definitions;

    private StructureRegistry(Map<String, StructureDef> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * @throws DuplicateNameException if two definitions share a name
     */
    public static StructureRegistry of(List<StructureDef> definitions) {
        Map<String, StructureDef> byName = new LinkedHashMap<>();
        for (StructureDef def : definitions) {
            StructureDef previous = byName.putIfAbsent(def.name(), def);
            if (previous != null) {
                throw new DuplicateNameException(def.name(), previous.span(), def.span());
            }
        }
        return new StructureRegistry(byName);
    }

    public Optional<StructureDef> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * @throws UndefinedStructureException if no definition has this name
     */
    public StructureDef require(String name, SourceSpan span) {
        StructureDef def = definitions.get(name);
        if (def == null) {
            throw new UndefinedStructureException(name, span);
        }
        return def;
    }

    public Collection<StructureDef> definitions() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }
}
