/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A non-fatal finding attached to a resolved structure.
 *
 * @param subject the offending node, link ({@code source->target}) or declaration key
 */
public record ResolutionWarning(
        @JsonProperty("kind") WarningKind kind,
        @JsonProperty("subject") String subject,
        @JsonProperty("message") String message
) {
}
