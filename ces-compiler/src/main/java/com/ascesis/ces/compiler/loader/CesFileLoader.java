/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.loader;

import com.ascesis.ces.api.ast.Argument;
import com.ascesis.ces.api.ast.CesFile;
import com.ascesis.ces.api.ast.ContextDeclaration;
import com.ascesis.ces.api.ast.Face;
import com.ascesis.ces.api.ast.FatArrowOp;
import com.ascesis.ces.api.ast.FatArrowRule;
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
import com.ascesis.ces.api.ast.ThinArrowShape;
import com.ascesis.ces.api.exceptions.InvalidAstException;
import com.ascesis.ces.api.exceptions.InvalidContextException;
import com.ascesis.ces.api.model.Capacity;
import com.ascesis.ces.compiler.loader.CesFileDocument.ContextDefinition;
import com.ascesis.ces.compiler.loader.CesFileDocument.ParamDefinition;
import com.ascesis.ces.compiler.loader.CesFileDocument.SpanDefinition;
import com.ascesis.ces.compiler.loader.CesFileDocument.StructureDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads the JSON interchange form of a parsed file into the typed AST.
 *
 * <h2>Polynomials</h2>
 * <ul>
 *   <li>{@code "a"}: a single node</li>
 *   <li>{@code ["a", "b"]}: juxtaposition (product) of the elements</li>
 *   <li>{@code {"sum": [...]}}: sum of the elements</li>
 *   <li>{@code {"group": x}}: x in parentheses</li>
 * </ul>
 *
 * <h2>Rule expressions</h2>
 * <ul>
 *   <li>{@code {"thin": {"shape": "forward", "nodes": p, "cause": p, "effect": p}}}</li>
 *   <li>{@code {"fat": {"head": p, "steps": [{"op": "=>", "poly": p}]}}}</li>
 *   <li>{@code {"sum": [rex...]}} and {@code {"product": [rex...]}}</li>
 *   <li>{@code {"instance": {"name": "K", "templated": true, "args": [{"kind": "node", "value": "a"}]}}}</li>
 * </ul>
 *
 * <p>Malformed documents fail with {@link InvalidAstException}; a node list
 * given as a non-plain polynomial fails with
 * {@link com.ascesis.ces.api.exceptions.InvalidNodeListException}.
 */
public class CesFileLoader {
    private static final Logger logger = Logger.getLogger(CesFileLoader.class.getName());

    private final ObjectMapper objectMapper;

    public CesFileLoader() {
        this(new ObjectMapper());
    }

    public CesFileLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IOException if the file cannot be read
     */
    public CesFile load(Path path) throws IOException {
        String content = Files.readString(path);
        CesFile file = parse(content, path.getFileName().toString());
        logger.fine(() -> "Loaded " + file.structures().size() + " structure(s) from " + path);
        return file;
    }

    public CesFile parse(String json, String origin) {
        CesFileDocument document;
        try {
            document = objectMapper.readValue(json, CesFileDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidAstException("Malformed JSON in " + origin + ": " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new InvalidAstException("Empty document: " + origin);
        }
        List<StructureDef> structures = new ArrayList<>();
        for (StructureDefinition definition : document.structures()) {
            structures.add(toStructureDef(definition));
        }
        List<ContextDeclaration> context = new ArrayList<>();
        for (ContextDefinition definition : document.context()) {
            context.add(toContextDeclaration(definition));
        }
        return new CesFile(document.origin() != null ? document.origin() : origin, structures, context);
    }

    private StructureDef toStructureDef(StructureDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new InvalidAstException("Structure definition missing or empty name");
        }
        if (definition.body() == null || definition.body().isNull()) {
            throw new InvalidAstException("Structure '" + definition.name() + "' has no body");
        }
        List<TemplateParam> params = new ArrayList<>();
        for (ParamDefinition param : definition.params()) {
            if (param.name() == null || param.kind() == null) {
                throw new InvalidAstException("Structure '" + definition.name() + "' has an incomplete parameter");
            }
            params.add(new TemplateParam(param.name(), enumValue(ParamKind.class, param.kind(), "parameter kind")));
        }
        return new StructureDef(definition.name(), params, toRex(definition.body()), toSpan(definition.span()));
    }

    Rex toRex(JsonNode node) {
        Map.Entry<String, JsonNode> tagged = singleField(node, "rule expression");
        JsonNode value = tagged.getValue();
        return switch (tagged.getKey()) {
            case "thin" -> toThin(value);
            case "fat" -> toFat(value);
            case "sum" -> new RexSum(toRexList(value, "sum"));
            case "product" -> new RexProduct(toRexList(value, "product"));
            case "instance" -> toInstance(value);
            default -> throw new InvalidAstException("Unknown rule expression: " + tagged.getKey());
        };
    }

    private List<Rex> toRexList(JsonNode node, String what) {
        if (!node.isArray() || node.isEmpty()) {
            throw new InvalidAstException("'" + what + "' needs a non-empty array");
        }
        List<Rex> result = new ArrayList<>();
        node.forEach(element -> result.add(toRex(element)));
        return result;
    }

    private ThinArrowRule toThin(JsonNode node) {
        ThinArrowShape shape = enumValue(ThinArrowShape.class, text(node, "shape"), "thin arrow shape");
        Polynomial nodes = toPolynomial(required(node, "nodes"));
        Polynomial cause = node.hasNonNull("cause") ? toPolynomial(node.get("cause")) : null;
        Polynomial effect = node.hasNonNull("effect") ? toPolynomial(node.get("effect")) : null;
        return switch (shape) {
            case EFFECT_ONLY -> ThinArrowRule.effectOnly(nodes, need(effect, "effect"));
            case CAUSE_ONLY -> ThinArrowRule.causeOnly(nodes, need(cause, "cause"));
            case CAUSE_THEN_EFFECT -> ThinArrowRule.causeThenEffect(nodes, need(cause, "cause"), need(effect, "effect"));
            case EFFECT_THEN_CAUSE -> ThinArrowRule.effectThenCause(nodes, need(effect, "effect"), need(cause, "cause"));
            case FORWARD -> ThinArrowRule.forward(need(cause, "cause"), nodes, need(effect, "effect"));
            case BACKWARD -> ThinArrowRule.backward(need(effect, "effect"), nodes, need(cause, "cause"));
        };
    }

    private FatArrowRule toFat(JsonNode node) {
        JsonNode steps = required(node, "steps");
        if (!steps.isArray() || steps.isEmpty()) {
            throw new InvalidAstException("Fat arrow rule needs at least one step");
        }
        FatArrowRule.Builder builder = FatArrowRule.startingAt(toPolynomial(required(node, "head")));
        for (JsonNode step : steps) {
            builder.then(toFatArrowOp(text(step, "op")), toPolynomial(required(step, "poly")));
        }
        return builder.build();
    }

    private static FatArrowOp toFatArrowOp(String value) {
        for (FatArrowOp op : FatArrowOp.values()) {
            if (op.symbol().equals(value)) {
                return op;
            }
        }
        return enumValue(FatArrowOp.class, value, "fat arrow operator");
    }

    private StructureInstance toInstance(JsonNode node) {
        String name = text(node, "name");
        boolean templated = node.path("templated").asBoolean(false);
        List<Argument> args = new ArrayList<>();
        for (JsonNode arg : node.path("args")) {
            ParamKind kind = enumValue(ParamKind.class, text(arg, "kind"), "argument kind");
            JsonNode value = required(arg, "value");
            args.add(switch (kind) {
                case NODE -> Argument.node(value.asText());
                case STRUCTURE -> Argument.structure(value.asText());
                case SIZE -> {
                    if (!value.canConvertToLong() || value.asLong() <= 0) {
                        throw new InvalidAstException("Size argument of '" + name + "' must be a positive integer");
                    }
                    yield Argument.size(value.asLong());
                }
                case NAME -> Argument.name(value.asText());
            });
        }
        return new StructureInstance(name, templated, args, toSpan(spanOf(node)));
    }

    Polynomial toPolynomial(JsonNode node) {
        if (node.isTextual()) {
            return Polynomial.of(node.asText());
        }
        if (node.isArray()) {
            if (node.isEmpty()) {
                return Polynomial.theta();
            }
            Iterator<JsonNode> factors = node.elements();
            Polynomial result = toPolynomial(factors.next());
            while (factors.hasNext()) {
                result = result.multiply(toPolynomial(factors.next()));
            }
            return result;
        }
        if (node.isObject()) {
            Map.Entry<String, JsonNode> tagged = singleField(node, "polynomial");
            if ("sum".equals(tagged.getKey()) && tagged.getValue().isArray()) {
                Polynomial result = Polynomial.theta();
                for (JsonNode term : tagged.getValue()) {
                    result = result.add(toPolynomial(term));
                }
                return result;
            }
            if ("group".equals(tagged.getKey())) {
                return toPolynomial(tagged.getValue()).parenthesized();
            }
        }
        throw new InvalidAstException("Malformed polynomial: " + node);
    }

    private ContextDeclaration toContextDeclaration(ContextDefinition definition) {
        if (definition.type() == null) {
            throw new InvalidAstException("Context declaration missing type");
        }
        SourceSpan span = toSpan(definition.span());
        return switch (definition.type().toLowerCase(Locale.ROOT)) {
            case "label" -> new ContextDeclaration.LabelDeclaration(
                    need(definition.node(), "node"), need(definition.label(), "label"), span);
            case "capacity" -> new ContextDeclaration.CapacityDeclaration(
                    toCapacity(definition), toPolynomial(need(definition.nodes(), "nodes")), span);
            case "multiplier" -> new ContextDeclaration.MultiplierDeclaration(
                    enumValue(Face.class, need(definition.face(), "face"), "face"),
                    definition.weight() != null ? definition.weight() : 1L,
                    toPolynomial(need(definition.nodes(), "nodes")),
                    toPolynomial(need(definition.suit(), "suit")), span);
            case "inhibitor" -> new ContextDeclaration.InhibitorDeclaration(
                    enumValue(Face.class, need(definition.face(), "face"), "face"),
                    toPolynomial(need(definition.nodes(), "nodes")),
                    toPolynomial(need(definition.suit(), "suit")), span);
            case "title" -> new ContextDeclaration.TitleDeclaration(need(definition.title(), "title"), span);
            default -> throw new InvalidAstException("Unknown context declaration type: " + definition.type());
        };
    }

    private Capacity toCapacity(ContextDefinition definition) {
        JsonNode capacity = need(definition.capacity(), "capacity");
        if (capacity.isTextual() && ("unbounded".equalsIgnoreCase(capacity.asText())
                || "omega".equalsIgnoreCase(capacity.asText()))) {
            return Capacity.unbounded();
        }
        if (!capacity.canConvertToLong()) {
            throw new InvalidAstException("Capacity must be a positive integer or \"unbounded\": " + capacity);
        }
        if (capacity.asLong() <= 0) {
            throw new InvalidContextException(String.valueOf(definition.nodes()),
                    "capacity must be positive, got " + capacity.asLong(), toSpan(definition.span()));
        }
        return Capacity.of(capacity.asLong());
    }

    private SpanDefinition spanOf(JsonNode node) {
        JsonNode span = node.get("span");
        if (span == null || span.isNull()) {
            return null;
        }
        return new SpanDefinition(span.path("start").asInt(-1), span.path("end").asInt(-1));
    }

    private static SourceSpan toSpan(SpanDefinition span) {
        return span == null ? SourceSpan.UNKNOWN : new SourceSpan(span.start(), span.end());
    }

    private static Map.Entry<String, JsonNode> singleField(JsonNode node, String what) {
        if (node == null || !node.isObject() || node.size() != 1) {
            throw new InvalidAstException("Malformed " + what + ": " + node);
        }
        return node.fields().next();
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new InvalidAstException("Missing field '" + field + "' in " + node);
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual()) {
            throw new InvalidAstException("Field '" + field + "' must be a string in " + node);
        }
        return value.asText();
    }

    private static <T> T need(T value, String field) {
        if (value == null) {
            throw new InvalidAstException("Missing field '" + field + "'");
        }
        return value;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new InvalidAstException("Unknown " + what + ": " + value, e);
        }
    }
}
