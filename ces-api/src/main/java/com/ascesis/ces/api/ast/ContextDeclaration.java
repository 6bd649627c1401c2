/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import com.ascesis.ces.api.model.Capacity;

import java.util.Objects;

/**
 * File-level declarations layered over the resolved root structure.
 */
public interface ContextDeclaration {

    SourceSpan span();

    /**
     * Overrides the display label of a node.
     */
    record LabelDeclaration(String node, String label, SourceSpan span) implements ContextDeclaration {
        public LabelDeclaration {
            Objects.requireNonNull(node, "Node cannot be null");
            Objects.requireNonNull(label, "Label cannot be null");
            span = span == null ? SourceSpan.UNKNOWN : span;
        }
    }

    /**
     * Sets the capacity of every node in a plain node list.
     */
    record CapacityDeclaration(Capacity capacity, Polynomial nodes, SourceSpan span) implements ContextDeclaration {
        public CapacityDeclaration {
            Objects.requireNonNull(capacity, "Capacity cannot be null");
            Objects.requireNonNull(nodes, "Nodes cannot be null");
            span = span == null ? SourceSpan.UNKNOWN : span;
        }
    }

    /**
     * Sets the weight of the links between each declared node and each node of the suit.
     */
    record MultiplierDeclaration(Face face, long weight, Polynomial nodes, Polynomial suit, SourceSpan span)
            implements ContextDeclaration {
        public MultiplierDeclaration {
            Objects.requireNonNull(face, "Face cannot be null");
            Objects.requireNonNull(nodes, "Nodes cannot be null");
            Objects.requireNonNull(suit, "Suit cannot be null");
            span = span == null ? SourceSpan.UNKNOWN : span;
        }
    }

    /**
     * Adds inhibitor arcs between each declared node and each node of the suit.
     */
    record InhibitorDeclaration(Face face, Polynomial nodes, Polynomial suit, SourceSpan span)
            implements ContextDeclaration {
        public InhibitorDeclaration {
            Objects.requireNonNull(face, "Face cannot be null");
            Objects.requireNonNull(nodes, "Nodes cannot be null");
            Objects.requireNonNull(suit, "Suit cannot be null");
            span = span == null ? SourceSpan.UNKNOWN : span;
        }
    }

    /**
     * Gives the resolved structure a human-readable title.
     */
    record TitleDeclaration(String title, SourceSpan span) implements ContextDeclaration {
        public TitleDeclaration {
            Objects.requireNonNull(title, "Title cannot be null");
            span = span == null ? SourceSpan.UNKNOWN : span;
        }
    }
}
