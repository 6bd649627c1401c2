/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

/**
 * Surface shapes of a thin arrow rule; N is the explicit node list, C the cause and E the effect polynomial.
 */
public enum ThinArrowShape {
    /** {@code N -> E} */
    EFFECT_ONLY,
    /** {@code N <- C} */
    CAUSE_ONLY,
    /** {@code N <- C -> E} */
    CAUSE_THEN_EFFECT,
    /** {@code N -> E <- C} */
    EFFECT_THEN_CAUSE,
    /** {@code C -> N -> E} */
    FORWARD,
    /** {@code E <- N <- C} */
    BACKWARD
}
