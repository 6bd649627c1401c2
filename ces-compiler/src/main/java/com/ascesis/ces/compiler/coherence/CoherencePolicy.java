/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.coherence;

import com.ascesis.ces.api.model.ResolutionWarning;
import com.ascesis.ces.api.model.Structure;

import java.util.List;

/**
 * Decides whether a resolved structure is acceptable.
 *
 * <p>Implementations either return the warnings to attach to the structure or
 * throw {@link com.ascesis.ces.api.exceptions.IncoherentStructureException}.
 */
@FunctionalInterface
public interface CoherencePolicy {

    List<ResolutionWarning> judge(Structure structure, CoherenceReport report);
}
