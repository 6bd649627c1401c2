/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api;

import java.util.Map;

/**
 * Callback interface for resolution stage events.
 *
 * <p>The pipeline consists of five stages:
 * <ol>
 *   <li>LOADING - Read the AST document from disk</li>
 *   <li>REGISTRY - Register definitions, rejecting duplicates</li>
 *   <li>INSTANTIATION - Expand the root structure into a draft</li>
 *   <li>CONTEXT_MERGE - Apply labels, capacities, multipliers and inhibitors</li>
 *   <li>COHERENCE - Check nodes and links against the coherence policy</li>
 * </ol>
 * LOADING is reported only by {@link IStructureCompiler#compile(java.nio.file.Path)}.
 */
public interface CompilationListener {

    /**
     * @param stageNumber current stage number (1-based)
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    void onStageComplete(String stageName, StageResult result);

    void onError(String stageName, Exception error);

    /**
     * Result of a single stage.
     *
     * @param metrics stage-specific metrics (e.g. "nodeCount", "fitMergeSteps")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
