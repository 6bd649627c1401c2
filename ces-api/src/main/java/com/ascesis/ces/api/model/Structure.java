/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.model;

import com.ascesis.ces.api.ast.Polynomial;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully resolved c-e structure: nodes with their cause and effect
 * polynomials, links, inhibitors and the warnings collected on the way.
 *
 * <p>Instances are immutable and safe to share between threads. Node and
 * link iteration order is deterministic for a given input.
 */
public final class Structure {

    private final String name;
    private final String title;
    private final Map<String, CesNode> nodes;
    private final Map<String, Link> links;
    private final List<InhibitorArc> inhibitors;
    private final List<ResolutionWarning> warnings;
    private final StructureStats stats;

    private Structure(Builder builder) {
        this.name = builder.name;
        this.title = builder.title;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.links = Collections.unmodifiableMap(new LinkedHashMap<>(builder.links));
        this.inhibitors = List.copyOf(builder.inhibitors);
        this.warnings = List.copyOf(builder.warnings);
        this.stats = builder.stats;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonIgnore
    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    @JsonProperty("title")
    String titleOrNull() {
        return title;
    }

    @JsonProperty("nodes")
    public Collection<CesNode> getNodes() {
        return nodes.values();
    }

    public Optional<CesNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    @JsonIgnore
    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    @JsonProperty("links")
    public Collection<Link> getLinks() {
        return links.values();
    }

    public Optional<Link> getLink(String source, String target) {
        return Optional.ofNullable(links.get(linkKey(source, target)));
    }

    @JsonProperty("inhibitors")
    public List<InhibitorArc> getInhibitors() {
        return inhibitors;
    }

    @JsonProperty("warnings")
    public List<ResolutionWarning> getWarnings() {
        return warnings;
    }

    @JsonProperty("stats")
    public StructureStats getStats() {
        return stats;
    }

    /**
     * @return the cause polynomial of the node, θ if the node is unknown
     */
    public Polynomial causeOf(String id) {
        CesNode node = nodes.get(id);
        return node == null ? Polynomial.theta() : node.cause();
    }

    /**
     * @return the effect polynomial of the node, θ if the node is unknown
     */
    public Polynomial effectOf(String id) {
        CesNode node = nodes.get(id);
        return node == null ? Polynomial.theta() : node.effect();
    }

    /**
     * Copy of this structure with the given warnings appended and stats replaced.
     */
    public Structure withWarnings(List<ResolutionWarning> extra, StructureStats newStats) {
        Builder builder = toBuilder();
        builder.warnings.addAll(extra);
        builder.stats = newStats;
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name);
        builder.title = title;
        builder.nodes.putAll(nodes);
        builder.links.putAll(links);
        builder.inhibitors.addAll(inhibitors);
        builder.warnings.addAll(warnings);
        builder.stats = stats;
        return builder;
    }

    static String linkKey(String source, String target) {
        return source + "\u0000" + target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Structure that)) return false;
        return name.equals(that.name)
                && Objects.equals(title, that.title)
                && nodes.equals(that.nodes)
                && links.equals(that.links)
                && inhibitors.equals(that.inhibitors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, title, nodes, links, inhibitors);
    }

    @Override
    public String toString() {
        return "Structure{" + name + ", nodes=" + nodes.size() + ", links=" + links.size() + "}";
    }

    public static final class Builder {
        private final String name;
        private String title;
        private final Map<String, CesNode> nodes = new LinkedHashMap<>();
        private final Map<String, Link> links = new LinkedHashMap<>();
        private final List<InhibitorArc> inhibitors = new ArrayList<>();
        private final List<ResolutionWarning> warnings = new ArrayList<>();
        private StructureStats stats;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Structure name cannot be null");
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder node(CesNode node) {
            nodes.put(node.id(), node);
            return this;
        }

        public Builder link(Link link) {
            links.put(linkKey(link.source(), link.target()), link);
            return this;
        }

        public Builder inhibitor(InhibitorArc arc) {
            if (!inhibitors.contains(arc)) {
                inhibitors.add(arc);
            }
            return this;
        }

        public Builder warning(ResolutionWarning warning) {
            warnings.add(warning);
            return this;
        }

        public Builder stats(StructureStats stats) {
            this.stats = stats;
            return this;
        }

        public Structure build() {
            return new Structure(this);
        }
    }
}
