/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record StructureStats(
        @JsonProperty("node_count") int nodeCount,
        @JsonProperty("link_count") int linkCount,
        @JsonProperty("full_link_count") int fullLinkCount,
        @JsonProperty("inhibitor_count") int inhibitorCount,
        @JsonProperty("instantiations") int instantiations,
        @JsonProperty("fit_merge_steps") int fitMergeSteps,
        @JsonProperty("resolution_time_nanos") long resolutionTimeNanos,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
}
