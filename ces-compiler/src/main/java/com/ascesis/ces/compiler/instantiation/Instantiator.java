/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.instantiation;

import com.ascesis.ces.api.ast.FatArrowRule;
import com.ascesis.ces.api.ast.Rex;
import com.ascesis.ces.api.ast.RexProduct;
import com.ascesis.ces.api.ast.RexSum;
import com.ascesis.ces.api.ast.SourceSpan;
import com.ascesis.ces.api.ast.StructureDef;
import com.ascesis.ces.api.ast.StructureInstance;
import com.ascesis.ces.api.ast.ThinArrowRule;
import com.ascesis.ces.api.exceptions.ArityOrTypeMismatchException;
import com.ascesis.ces.api.exceptions.CompilationException;
import com.ascesis.ces.api.exceptions.CyclicInstantiationException;
import com.ascesis.ces.api.exceptions.InvalidAstException;
import com.ascesis.ces.compiler.derivation.PortLinkDeriver;
import com.ascesis.ces.compiler.fit.FitResult;
import com.ascesis.ces.compiler.fit.FitTransformer;
import com.ascesis.ces.compiler.model.Fragment;
import com.ascesis.ces.compiler.model.NodeDictionary;
import com.ascesis.ces.compiler.registry.StructureRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Expands structure instances into fragments.
 *
 * <p>One instantiator serves a single file resolution: it owns the node
 * dictionary and the active instantiation path, and must not be shared
 * between threads. The root structure is evaluated once; reaching it again
 * from its own expansion is reported as a cycle like any other. Template
 * instantiations are numbered in expansion order, starting at 1, and the
 * number scopes the instantiation's local nodes.
 */
public class Instantiator {
    private static final Logger logger = Logger.getLogger(Instantiator.class.getName());

    private final StructureRegistry registry;
    private final FitTransformer fitTransformer;
    private final PortLinkDeriver deriver;
    private final NodeDictionary dictionary = new NodeDictionary();
    private final Deque<String> activePath = new ArrayDeque<>();

    private int instantiations;
    private int templateInstantiations;
    private int fitMergeSteps;

    public Instantiator(StructureRegistry registry, FitTransformer fitTransformer, PortLinkDeriver deriver) {
        this.registry = registry;
        this.fitTransformer = fitTransformer;
        this.deriver = deriver;
    }

    /**
     * Evaluates the root structure.
     *
     * @throws com.ascesis.ces.api.exceptions.UndefinedStructureException if the root is not defined
     * @throws ArityOrTypeMismatchException if the root declares parameters
     */
    public Fragment instantiateRoot(String rootName) {
        StructureDef root = registry.require(rootName, SourceSpan.UNKNOWN);
        if (root.isTemplate()) {
            throw new ArityOrTypeMismatchException(rootName,
                    "the root structure cannot declare parameters", root.span());
        }
        logger.fine(() -> "Instantiating root structure '" + rootName + "'");
        return expand(root, root.body());
    }

    public Fragment evaluate(Rex rex) {
        if (rex instanceof ThinArrowRule thin) {
            return deriver.derive(thin, dictionary);
        }
        if (rex instanceof FatArrowRule fat) {
            FitResult fit = fitTransformer.transform(fat);
            fitMergeSteps += fit.mergeSteps();
            Fragment result = Fragment.empty(dictionary);
            for (ThinArrowRule thin : fit.rules()) {
                result = result.sum(deriver.derive(thin, dictionary));
            }
            return result;
        }
        if (rex instanceof RexSum sum) {
            Fragment result = Fragment.empty(dictionary);
            for (Rex term : sum.terms()) {
                result = result.sum(evaluate(term));
            }
            return result;
        }
        if (rex instanceof RexProduct product) {
            Iterator<Rex> factors = product.factors().iterator();
            Fragment result = evaluate(factors.next());
            while (factors.hasNext()) {
                result = result.product(evaluate(factors.next()));
            }
            return result;
        }
        if (rex instanceof StructureInstance instance) {
            return instantiate(instance);
        }
        throw new InvalidAstException("Unsupported rule expression: " + rex.getClass().getSimpleName());
    }

    private Fragment instantiate(StructureInstance instance) {
        StructureDef def = registry.require(instance.name(), instance.span());
        if (activePath.contains(def.name())) {
            throw new CyclicInstantiationException(cycleTo(def.name()));
        }
        if (def.isTemplate() && !instance.templated()) {
            throw new ArityOrTypeMismatchException(def.name(),
                    "template instantiated without '!' and arguments", instance.span());
        }
        if (!def.isTemplate() && (instance.templated() || !instance.args().isEmpty())) {
            throw new ArityOrTypeMismatchException(def.name(),
                    "immediate structure instantiated with '!' or arguments", instance.span());
        }
        Rex body = def.isTemplate()
                ? TemplateSubstitution.bind(def, instance, ++templateInstantiations).apply(def.body())
                : def.body();
        return expand(def, body);
    }

    private Fragment expand(StructureDef def, Rex body) {
        instantiations++;
        activePath.addLast(def.name());
        try {
            return evaluate(body);
        } catch (CompilationException e) {
            throw e.addFrame(def.name());
        } finally {
            activePath.removeLast();
        }
    }

    private List<String> cycleTo(String name) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String frame : activePath) {
            if (frame.equals(name)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(frame);
            }
        }
        cycle.add(name);
        return cycle;
    }

    public NodeDictionary dictionary() {
        return dictionary;
    }

    public int instantiations() {
        return instantiations;
    }

    public int fitMergeSteps() {
        return fitMergeSteps;
    }
}
