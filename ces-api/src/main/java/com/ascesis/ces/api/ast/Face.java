/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

/**
 * The side of a node a multiplier or inhibitor declaration applies to.
 */
public enum Face {
    /** The node's effects: declared nodes send to the suit. */
    EFFECT,
    /** The node's causes: the suit sends to the declared nodes. */
    CAUSE
}
