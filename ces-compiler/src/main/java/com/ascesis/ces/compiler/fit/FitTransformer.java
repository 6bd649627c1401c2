/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.fit;

import com.ascesis.ces.api.ast.FatArrowOp;
import com.ascesis.ces.api.ast.FatArrowRule;
import com.ascesis.ces.api.ast.NodeList;
import com.ascesis.ces.api.ast.Polynomial;
import com.ascesis.ces.api.ast.ThinArrowRule;
import com.ascesis.ces.api.exceptions.FitDivergenceException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Fat-into-thin (FIT) transformation.
 *
 * <p>The chain {@code P0 op1 P1 ... opk Pk} is split into binary pairs over
 * adjacent polynomials, each oriented by its own operator ({@code <=>}
 * yields both orientations). Every oriented pair {@code P => Q} contributes
 * an effect-only rule {@code nodes(P) -> Q} and a cause-only rule
 * {@code nodes(Q) <- P}, where {@code nodes(X)} is the flattened node set
 * of X.
 *
 * <p>Rules of the same polarity are then merged until a fixed point:
 * rules with identical node lists add their polynomials, rules with
 * equivalent polynomials (up to monomial and factor order) union their
 * node lists. Every merge removes one
 * rule, so the loop ends after at most as many merges as there were
 * initial rules. Finally effect-only and cause-only rules sharing a node
 * list are paired into two-sided rules.
 *
 * <p>Not every thin-rule structure is reachable from fat rules alone.
 */
public class FitTransformer {
    private static final Logger logger = Logger.getLogger(FitTransformer.class.getName());

    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    private final int maxIterations;

    public FitTransformer() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public FitTransformer(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        this.maxIterations = maxIterations;
    }

    /** Mutable one-sided rule used while simplifying. */
    private static final class OneSided {
        NodeList nodes;
        Polynomial polynomial;

        OneSided(NodeList nodes, Polynomial polynomial) {
            this.nodes = nodes;
            this.polynomial = polynomial;
        }
    }

    /**
     * @throws FitDivergenceException if no fixed point is reached within the iteration bound
     */
    public FitResult transform(FatArrowRule rule) {
        List<OneSided> effectRules = new ArrayList<>();
        List<OneSided> causeRules = new ArrayList<>();

        for (Polynomial[] pair : orientedPairs(rule)) {
            Polynomial cause = pair[0];
            Polynomial effect = pair[1];
            effectRules.add(new OneSided(cause.flatten(), effect));
            causeRules.add(new OneSided(effect.flatten(), cause));
        }
        int initialRuleCount = effectRules.size() + causeRules.size();

        int mergeSteps = 0;
        int passes = 0;
        while (true) {
            if (++passes > maxIterations) {
                throw new FitDivergenceException(rule.toString(), maxIterations);
            }
            int merged = mergeSameNodes(effectRules) + mergeSameNodes(causeRules)
                    + mergeSamePolynomial(effectRules) + mergeSamePolynomial(causeRules);
            if (merged == 0) {
                break;
            }
            mergeSteps += merged;
        }

        FitResult result = new FitResult(pair(effectRules, causeRules), initialRuleCount, mergeSteps, passes);
        logger.fine(() -> String.format("FIT '%s': %d initial rules, %d merges in %d passes, %d thin rules",
                rule, result.initialRuleCount(), result.mergeSteps(), result.passes(), result.rules().size()));
        return result;
    }

    /**
     * Adjacent polynomial pairs as (cause, effect), in chain order.
     */
    static List<Polynomial[]> orientedPairs(FatArrowRule rule) {
        List<Polynomial[]> pairs = new ArrayList<>();
        Polynomial previous = rule.head();
        for (FatArrowRule.Step step : rule.steps()) {
            Polynomial next = step.target();
            FatArrowOp op = step.op();
            if (op == FatArrowOp.FORWARD || op == FatArrowOp.BIDIRECTIONAL) {
                pairs.add(new Polynomial[]{previous, next});
            }
            if (op == FatArrowOp.BACKWARD || op == FatArrowOp.BIDIRECTIONAL) {
                pairs.add(new Polynomial[]{next, previous});
            }
            previous = next;
        }
        return pairs;
    }

    private static int mergeSameNodes(List<OneSided> rules) {
        int merged = 0;
        List<OneSided> kept = new ArrayList<>(rules.size());
        outer:
        for (OneSided rule : rules) {
            for (OneSided target : kept) {
                if (target.nodes.equals(rule.nodes)) {
                    target.polynomial = target.polynomial.add(rule.polynomial);
                    merged++;
                    continue outer;
                }
            }
            kept.add(rule);
        }
        rules.clear();
        rules.addAll(kept);
        return merged;
    }

    private static int mergeSamePolynomial(List<OneSided> rules) {
        int merged = 0;
        List<OneSided> kept = new ArrayList<>(rules.size());
        outer:
        for (OneSided rule : rules) {
            for (OneSided target : kept) {
                if (target.polynomial.isEquivalentTo(rule.polynomial)) {
                    target.nodes = target.nodes.union(rule.nodes);
                    merged++;
                    continue outer;
                }
            }
            kept.add(rule);
        }
        rules.clear();
        rules.addAll(kept);
        return merged;
    }

    private static List<ThinArrowRule> pair(List<OneSided> effectRules, List<OneSided> causeRules) {
        List<Polynomial> pairedCauses = new ArrayList<>(effectRules.size());
        effectRules.forEach(rule -> pairedCauses.add(Polynomial.theta()));
        List<OneSided> unpaired = new ArrayList<>();

        outer:
        for (OneSided causeRule : causeRules) {
            for (int i = 0; i < effectRules.size(); i++) {
                if (effectRules.get(i).nodes.equals(causeRule.nodes) && pairedCauses.get(i).isTheta()) {
                    pairedCauses.set(i, causeRule.polynomial);
                    continue outer;
                }
            }
            unpaired.add(causeRule);
        }

        List<ThinArrowRule> result = new ArrayList<>(effectRules.size() + unpaired.size());
        for (int i = 0; i < effectRules.size(); i++) {
            OneSided effectRule = effectRules.get(i);
            result.add(ThinArrowRule.of(effectRule.nodes, pairedCauses.get(i), effectRule.polynomial));
        }
        for (OneSided causeRule : unpaired) {
            result.add(ThinArrowRule.of(causeRule.nodes, causeRule.polynomial, Polynomial.theta()));
        }
        return result;
    }
}
