/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.fit;

import com.ascesis.ces.api.ast.ThinArrowRule;

import java.util.List;

/**
 * Outcome of the fat-into-thin transformation of one fat arrow rule.
 *
 * @param rules       thin rules, effect-bearing rules first
 * @param initialRuleCount number of one-sided thin rules before simplification
 * @param mergeSteps  merges applied by the fixed-point loop; never exceeds {@code initialRuleCount}
 * @param passes      passes of the fixed-point loop, the last one merging nothing
 */
public record FitResult(List<ThinArrowRule> rules, int initialRuleCount, int mergeSteps, int passes) {

    public FitResult {
        rules = List.copyOf(rules);
    }
}
