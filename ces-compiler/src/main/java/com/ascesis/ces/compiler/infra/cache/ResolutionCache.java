/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.infra.cache;

import com.ascesis.ces.api.ast.CesFile;
import com.ascesis.ces.api.model.Structure;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Memoizes resolved structures by their input file.
 *
 * <p>{@link CesFile} is an immutable value with structural equality, so two
 * identical files share one entry. Failed resolutions are not cached: the
 * exception propagates to the caller and the next request resolves again.
 */
public class ResolutionCache {
    private static final Logger logger = Logger.getLogger(ResolutionCache.class.getName());

    private final Cache<CesFile, Structure> cache;

    public ResolutionCache(long maxSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        logger.fine(() -> "Resolution cache created with maximumSize=" + maxSize);
    }

    public Structure get(CesFile file, Function<CesFile, Structure> resolver) {
        return cache.get(file, resolver);
    }

    public Optional<Structure> getIfPresent(CesFile file) {
        return Optional.ofNullable(cache.getIfPresent(file));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
