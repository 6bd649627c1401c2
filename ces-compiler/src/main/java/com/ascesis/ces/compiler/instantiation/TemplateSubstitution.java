/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.instantiation;

import com.ascesis.ces.api.ast.Argument;
import com.ascesis.ces.api.ast.FatArrowRule;
import com.ascesis.ces.api.ast.NodeList;
import com.ascesis.ces.api.ast.ParamKind;
import com.ascesis.ces.api.ast.Polynomial;
import com.ascesis.ces.api.ast.Rex;
import com.ascesis.ces.api.ast.RexProduct;
import com.ascesis.ces.api.ast.RexSum;
import com.ascesis.ces.api.ast.SourceSpan;
import com.ascesis.ces.api.ast.StructureDef;
import com.ascesis.ces.api.ast.StructureInstance;
import com.ascesis.ces.api.ast.TemplateParam;
import com.ascesis.ces.api.ast.ThinArrowRule;
import com.ascesis.ces.api.exceptions.ArityOrTypeMismatchException;
import com.ascesis.ces.api.exceptions.InvalidAstException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binding of template parameters to actual arguments, applied to a template
 * body as a pure function: the result is a freshly built rex and the body
 * is never modified.
 *
 * <ul>
 *   <li>a node occurrence naming a {@link ParamKind#NODE} parameter is replaced by the bound node</li>
 *   <li>an instance naming a {@link ParamKind#STRUCTURE} parameter is redirected to the bound structure</li>
 *   <li>a node or structure argument naming any parameter is replaced by the bound argument</li>
 * </ul>
 * Nodes that are not parameters are local to one instantiation: they are
 * renamed into the instantiation's scope, e.g. {@code hub} becomes
 * {@code Hub#2.hub} in the second template instantiation of a resolution,
 * so no two instantiations share them. {@link ParamKind#SIZE} and
 * {@link ParamKind#NAME} parameters are checked but never substituted.
 */
public final class TemplateSubstitution {

    private final String structureName;
    private final String scope;
    private final Map<String, TemplateParam> params;
    private final Map<String, Argument> bindings;

    private TemplateSubstitution(String structureName, String scope, Map<String, TemplateParam> params,
                                 Map<String, Argument> bindings) {
        this.structureName = structureName;
        this.scope = scope;
        this.params = params;
        this.bindings = bindings;
    }

    /**
     * Checks arity and argument kinds, then binds each parameter.
     *
     * @param ordinal number of this template instantiation within the resolution, unique per resolution
     * @throws ArityOrTypeMismatchException on a count or kind mismatch
     */
    public static TemplateSubstitution bind(StructureDef def, StructureInstance instance, int ordinal) {
        List<TemplateParam> declared = def.params();
        List<Argument> args = instance.args();
        if (declared.size() != args.size()) {
            throw new ArityOrTypeMismatchException(def.name(),
                    "expected " + declared.size() + " argument(s), got " + args.size(), instance.span());
        }
        Map<String, TemplateParam> params = new LinkedHashMap<>();
        Map<String, Argument> bindings = new LinkedHashMap<>();
        for (int i = 0; i < declared.size(); i++) {
            TemplateParam param = declared.get(i);
            Argument arg = args.get(i);
            if (param.kind() != arg.kind()) {
                throw new ArityOrTypeMismatchException(def.name(),
                        "argument " + (i + 1) + " for parameter '" + param.name() + "' must be "
                                + param.kind() + ", got " + arg.kind() + " '" + arg + "'", instance.span());
            }
            params.put(param.name(), param);
            bindings.put(param.name(), arg);
        }
        return new TemplateSubstitution(def.name(), def.name() + "#" + ordinal, params, bindings);
    }

    public Rex apply(Rex rex) {
        if (rex instanceof ThinArrowRule thin) {
            return new ThinArrowRule(thin.shape(), renameNodes(thin.nodes()),
                    renamePolynomial(thin.cause()), renamePolynomial(thin.effect()));
        }
        if (rex instanceof FatArrowRule fat) {
            List<FatArrowRule.Step> steps = new ArrayList<>(fat.steps().size());
            for (FatArrowRule.Step step : fat.steps()) {
                steps.add(new FatArrowRule.Step(step.op(), renamePolynomial(step.target())));
            }
            return new FatArrowRule(renamePolynomial(fat.head()), steps);
        }
        if (rex instanceof RexSum sum) {
            return new RexSum(sum.terms().stream().map(this::apply).toList());
        }
        if (rex instanceof RexProduct product) {
            return new RexProduct(product.factors().stream().map(this::apply).toList());
        }
        if (rex instanceof StructureInstance instance) {
            return applyToInstance(instance);
        }
        throw new InvalidAstException("Unsupported rule expression: " + rex.getClass().getSimpleName());
    }

    private StructureInstance applyToInstance(StructureInstance instance) {
        String target = instance.name();
        TemplateParam param = params.get(target);
        if (param != null) {
            if (param.kind() != ParamKind.STRUCTURE) {
                throw new ArityOrTypeMismatchException(structureName,
                        "parameter '" + target + "' of kind " + param.kind() + " used as a structure",
                        instance.span());
            }
            target = ((Argument.StructureArg) bindings.get(target)).name();
        }
        List<Argument> args = new ArrayList<>(instance.args().size());
        for (Argument arg : instance.args()) {
            args.add(forward(arg));
        }
        return new StructureInstance(target, instance.templated(), args, instance.span());
    }

    private Argument forward(Argument arg) {
        String reference = null;
        if (arg instanceof Argument.NodeArg node) {
            reference = node.node();
        } else if (arg instanceof Argument.StructureArg structure) {
            reference = structure.name();
        }
        if (reference != null && bindings.containsKey(reference)) {
            return bindings.get(reference);
        }
        if (arg instanceof Argument.NodeArg node) {
            return Argument.node(local(node.node()));
        }
        return arg;
    }

    private String local(String node) {
        return scope + "." + node;
    }

    private String renameNode(String node) {
        TemplateParam param = params.get(node);
        if (param == null) {
            return local(node);
        }
        if (param.kind() != ParamKind.NODE) {
            throw new ArityOrTypeMismatchException(structureName,
                    "parameter '" + node + "' of kind " + param.kind() + " used as a node", SourceSpan.UNKNOWN);
        }
        return ((Argument.NodeArg) bindings.get(node)).node();
    }

    private Polynomial renamePolynomial(Polynomial polynomial) {
        return polynomial.rename(this::renameNode);
    }

    private NodeList renameNodes(NodeList nodes) {
        return nodes.rename(this::renameNode);
    }
}
