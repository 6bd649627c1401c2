/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.context;

import com.ascesis.ces.api.ast.ContextDeclaration;
import com.ascesis.ces.api.ast.ContextDeclaration.CapacityDeclaration;
import com.ascesis.ces.api.ast.ContextDeclaration.InhibitorDeclaration;
import com.ascesis.ces.api.ast.ContextDeclaration.LabelDeclaration;
import com.ascesis.ces.api.ast.ContextDeclaration.MultiplierDeclaration;
import com.ascesis.ces.api.ast.ContextDeclaration.TitleDeclaration;
import com.ascesis.ces.api.ast.Face;
import com.ascesis.ces.api.ast.Polynomial;
import com.ascesis.ces.api.exceptions.InvalidAstException;
import com.ascesis.ces.api.exceptions.InvalidContextException;
import com.ascesis.ces.api.model.CesNode;
import com.ascesis.ces.api.model.InhibitorArc;
import com.ascesis.ces.api.model.Link;
import com.ascesis.ces.api.model.ResolutionWarning;
import com.ascesis.ces.api.model.Structure;
import com.ascesis.ces.api.model.WarningKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Applies context declarations to a resolved structure.
 *
 * <p>Declarations are applied in file order and the last one for a given
 * key wins: a node's label, a node's capacity, a link's weight, the title.
 * Each replaced declaration yields an {@link WarningKind#OVERRIDDEN_DECLARATION}
 * warning. Inhibitor arcs only accumulate. Declarations about nodes or
 * links missing from the structure are skipped with a warning.
 */
public class ContextMerger {
    private static final Logger logger = Logger.getLogger(ContextMerger.class.getName());

    /**
     * @throws InvalidContextException if a multiplier weight is not positive
     * @throws com.ascesis.ces.api.exceptions.InvalidNodeListException if a node-list operand is not plain
     */
    public Structure merge(Structure structure, List<ContextDeclaration> declarations) {
        if (declarations.isEmpty()) {
            return structure;
        }
        Session session = new Session(structure);
        for (ContextDeclaration declaration : declarations) {
            session.apply(declaration);
        }
        return session.build();
    }

    /** Endpoints of a link; node identifiers may contain any character. */
    private record LinkKey(String source, String target) {
        @Override
        public String toString() {
            return source + "->" + target;
        }
    }

    /** Override bookkeeping key for a multiplier on one link. */
    private record WeightKey(LinkKey link) {
    }

    private static final class Session {
        private final Structure structure;
        private final Map<String, CesNode> nodes = new LinkedHashMap<>();
        private final Map<LinkKey, Link> links = new LinkedHashMap<>();
        private final Map<Object, ContextDeclaration> declaredBy = new HashMap<>();
        private final List<InhibitorArc> inhibitors = new ArrayList<>();
        private final List<ResolutionWarning> warnings = new ArrayList<>();
        private String title;

        Session(Structure structure) {
            this.structure = structure;
            structure.getNodes().forEach(node -> nodes.put(node.id(), node));
            structure.getLinks().forEach(link -> links.put(new LinkKey(link.source(), link.target()), link));
            this.title = structure.getTitle().orElse(null);
        }

        void apply(ContextDeclaration declaration) {
            if (declaration instanceof LabelDeclaration label) {
                applyLabel(label);
            } else if (declaration instanceof CapacityDeclaration capacity) {
                applyCapacity(capacity);
            } else if (declaration instanceof MultiplierDeclaration multiplier) {
                applyMultiplier(multiplier);
            } else if (declaration instanceof InhibitorDeclaration inhibitor) {
                applyInhibitor(inhibitor);
            } else if (declaration instanceof TitleDeclaration titleDeclaration) {
                record("title", declaration);
                title = titleDeclaration.title();
            } else {
                throw new InvalidAstException("Unsupported context declaration: "
                        + declaration.getClass().getSimpleName());
            }
        }

        private void applyLabel(LabelDeclaration declaration) {
            CesNode node = knownNode(declaration.node());
            if (node == null) {
                return;
            }
            record("label:" + node.id(), declaration);
            nodes.put(node.id(), new CesNode(node.id(), declaration.label(), node.capacity(),
                    node.cause(), node.effect()));
        }

        private void applyCapacity(CapacityDeclaration declaration) {
            for (String id : declaration.nodes().toNodeList().nodes()) {
                CesNode node = knownNode(id);
                if (node == null) {
                    continue;
                }
                record("capacity:" + id, declaration);
                nodes.put(id, new CesNode(id, node.label(), declaration.capacity(), node.cause(), node.effect()));
            }
        }

        private void applyMultiplier(MultiplierDeclaration declaration) {
            List<String> declared = declaration.nodes().toNodeList().nodes();
            if (declaration.weight() <= 0) {
                throw new InvalidContextException(String.join(" ", declared),
                        "weight must be positive, got " + declaration.weight(), declaration.span());
            }
            for (String id : declared) {
                if (knownNode(id) == null) {
                    continue;
                }
                for (String other : suitOf(declaration.suit())) {
                    String source = declaration.face() == Face.EFFECT ? id : other;
                    String target = declaration.face() == Face.EFFECT ? other : id;
                    LinkKey key = new LinkKey(source, target);
                    Link link = links.get(key);
                    if (link == null) {
                        warn(WarningKind.UNKNOWN_LINK, key.toString(),
                                "Weight declared for a link missing from the structure");
                        continue;
                    }
                    record(new WeightKey(key), "weight:" + key, declaration);
                    links.put(key, new Link(source, target, link.kind(), declaration.weight()));
                }
            }
        }

        private void applyInhibitor(InhibitorDeclaration declaration) {
            for (String id : declaration.nodes().toNodeList().nodes()) {
                if (knownNode(id) == null) {
                    continue;
                }
                for (String other : suitOf(declaration.suit())) {
                    InhibitorArc arc = declaration.face() == Face.EFFECT
                            ? new InhibitorArc(id, other, Face.EFFECT)
                            : new InhibitorArc(other, id, Face.CAUSE);
                    if (!inhibitors.contains(arc)) {
                        inhibitors.add(arc);
                    }
                }
            }
        }

        private List<String> suitOf(Polynomial suit) {
            List<String> known = new ArrayList<>();
            for (String id : suit.nodes()) {
                if (knownNode(id) != null) {
                    known.add(id);
                }
            }
            return known;
        }

        private CesNode knownNode(String id) {
            CesNode node = nodes.get(id);
            if (node == null) {
                warn(WarningKind.UNKNOWN_NODE, id, "Context declaration names a node missing from the structure");
            }
            return node;
        }

        private void record(String key, ContextDeclaration declaration) {
            record(key, key, declaration);
        }

        private void record(Object key, String subject, ContextDeclaration declaration) {
            ContextDeclaration previous = declaredBy.put(key, declaration);
            if (previous != null) {
                logger.fine(() -> "Context declaration for '" + subject + "' overrides an earlier one");
                warn(WarningKind.OVERRIDDEN_DECLARATION, subject, "Earlier declaration replaced");
            }
        }

        private void warn(WarningKind kind, String subject, String message) {
            if (kind != WarningKind.OVERRIDDEN_DECLARATION) {
                logger.warning(message + ": " + subject);
            }
            warnings.add(new ResolutionWarning(kind, subject, message));
        }

        Structure build() {
            Structure.Builder builder = structure.toBuilder().title(title);
            nodes.values().forEach(builder::node);
            links.values().forEach(builder::link);
            inhibitors.forEach(builder::inhibitor);
            warnings.forEach(builder::warning);
            return builder.build();
        }
    }
}
