/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler;

import com.ascesis.ces.api.CompilationListener;
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
import com.ascesis.ces.api.ast.StructureDef;
import com.ascesis.ces.api.ast.StructureInstance;
import com.ascesis.ces.api.ast.TemplateParam;
import com.ascesis.ces.api.ast.ThinArrowRule;
import com.ascesis.ces.api.exceptions.CyclicInstantiationException;
import com.ascesis.ces.api.exceptions.DuplicateNameException;
import com.ascesis.ces.api.exceptions.IncoherentStructureException;
import com.ascesis.ces.api.exceptions.InvalidNodeListException;
import com.ascesis.ces.api.exceptions.UndefinedStructureException;
import com.ascesis.ces.api.model.Capacity;
import com.ascesis.ces.api.model.CesNode;
import com.ascesis.ces.api.model.InhibitorArc;
import com.ascesis.ces.api.model.LinkKind;
import com.ascesis.ces.api.model.ResolutionWarning;
import com.ascesis.ces.api.model.Structure;
import com.ascesis.ces.api.model.WarningKind;
import com.ascesis.ces.compiler.coherence.CoherenceMode;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class StructureCompilerTest {

    private Tracer tracer;

    @BeforeEach
    void setUp() {
        tracer = OpenTelemetry.noop().getTracer("test");
    }

    private StructureCompiler compiler(CoherenceMode mode) {
        return new StructureCompiler(tracer, CompilerConfig.defaults().toBuilder()
                .coherenceMode(mode)
                .cacheEnabled(false)
                .build());
    }

    private static CesFile mainOnly(Rex body) {
        return CesFile.of(StructureDef.immediate("Main", body));
    }

    private static Polynomial p(String node) {
        return Polynomial.of(node);
    }

    @Nested
    @DisplayName("Resolution scenarios")
    class Scenarios {

        @Test
        @DisplayName("Arrow: a => b yields one full link")
        void arrow() {
            Structure structure = compiler(CoherenceMode.LENIENT).resolve(mainOnly(FatArrowRule.forward(p("a"), p("b"))));

            assertThat(structure.getName()).isEqualTo("Main");
            assertThat(structure.getNodes()).extracting(CesNode::id).containsExactly("a", "b");
            assertThat(structure.getLink("a", "b")).hasValueSatisfying(link -> {
                assertThat(link.kind()).isEqualTo(LinkKind.FULL);
                assertThat(link.weight()).isEqualTo(1L);
            });
            assertThat(structure.effectOf("a")).isEqualTo(p("b"));
            assertThat(structure.causeOf("b")).isEqualTo(p("a"));
            assertThat(structure.getWarnings()).extracting(ResolutionWarning::subject).containsExactly("a", "b");
            assertThat(structure.getStats().linkCount()).isEqualTo(1);
            assertThat(structure.getStats().fullLinkCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Fork: a => b c gives a single joint effect")
        void fork() {
            Structure structure = compiler(CoherenceMode.LENIENT)
                    .resolve(mainOnly(FatArrowRule.forward(p("a"), Polynomial.product("b", "c"))));

            assertThat(structure.effectOf("a").monomials()).hasSize(1);
            assertThat(structure.effectOf("a")).isEqualTo(Polynomial.product("b", "c"));
            assertThat(structure.getLinks()).hasSize(2).allMatch(link -> link.kind() == LinkKind.FULL);
        }

        @Test
        @DisplayName("Choice: a => b + c gives two alternative effects")
        void choice() {
            Structure structure = compiler(CoherenceMode.LENIENT)
                    .resolve(mainOnly(FatArrowRule.forward(p("a"), Polynomial.sum("b", "c"))));

            assertThat(structure.effectOf("a")).isEqualTo(Polynomial.sum("b", "c"));
            assertThat(structure.getLink("a", "b")).map(l -> l.kind()).contains(LinkKind.FULL);
            assertThat(structure.getLink("a", "c")).map(l -> l.kind()).contains(LinkKind.FULL);
        }

        @Test
        @DisplayName("Loop: a => b => a is coherent under every mode")
        void loop() {
            FatArrowRule loop = FatArrowRule.startingAt(p("a"))
                    .then(FatArrowOp.FORWARD, p("b"))
                    .then(FatArrowOp.FORWARD, p("a"))
                    .build();

            for (CoherenceMode mode : CoherenceMode.values()) {
                Structure structure = compiler(mode).resolve(mainOnly(loop));
                assertThat(structure.getLinks()).hasSize(2).allMatch(link -> link.kind() == LinkKind.FULL);
                assertThat(structure.getWarnings()).isEmpty();
            }
        }

        @Test
        @DisplayName("Product of rules multiplies the effects of a shared node")
        void productOfRules() {
            Structure structure = compiler(CoherenceMode.LENIENT).resolve(mainOnly(new RexProduct(List.of(
                    FatArrowRule.forward(p("a"), p("b")),
                    FatArrowRule.forward(p("a"), p("c"))))));

            assertThat(structure.effectOf("a")).isEqualTo(Polynomial.product("b", "c"));
        }

        @Test
        @DisplayName("Templates instantiated through the root are merged into one structure")
        void templatedPipeline() {
            StructureDef arrow = StructureDef.template("Arrow",
                    List.of(new TemplateParam("x", ParamKind.NODE),
                            new TemplateParam("y", ParamKind.NODE)),
                    FatArrowRule.forward(p("x"), p("y")));
            StructureDef main = StructureDef.immediate("Main", new RexSum(List.of(
                    StructureInstance.template("Arrow", Argument.node("a"),
                            Argument.node("b")),
                    StructureInstance.template("Arrow", Argument.node("b"),
                            Argument.node("c")))));

            Structure structure = compiler(CoherenceMode.LENIENT).resolve(CesFile.of(arrow, main));

            assertThat(structure.getNodes()).extracting(CesNode::id).containsExactly("a", "b", "c");
            assertThat(structure.causeOf("b")).isEqualTo(p("a"));
            assertThat(structure.effectOf("b")).isEqualTo(p("c"));
            assertThat(structure.getStats().instantiations()).isEqualTo(3);
            assertThat(structure.getWarnings()).extracting(ResolutionWarning::subject).containsExactly("a", "c");
        }

        @Test
        @DisplayName("Custom root name selects another structure")
        void customRoot() {
            StructureCompiler compiler = new StructureCompiler(tracer,
                    CompilerConfig.defaults().toBuilder().rootName("Top").cacheEnabled(false).build());
            CesFile file = CesFile.of(StructureDef.immediate("Top", FatArrowRule.forward(p("a"), p("b"))));

            assertThat(compiler.resolve(file).getName()).isEqualTo("Top");
        }
    }

    @Nested
    @DisplayName("Coherence modes")
    class Coherence {

        @Test
        void strictRejectsDanglingNodes() {
            assertThatThrownBy(() -> compiler(CoherenceMode.STRICT)
                    .resolve(mainOnly(FatArrowRule.forward(p("a"), p("b")))))
                    .isInstanceOf(IncoherentStructureException.class)
                    .satisfies(e -> assertThat(((IncoherentStructureException) e).getOffenders())
                            .containsExactly("a", "b"));
        }

        @Test
        void properRejectsPartialLinks() {
            assertThatThrownBy(() -> compiler(CoherenceMode.PROPER)
                    .resolve(mainOnly(ThinArrowRule.effectOnly(p("a"), p("b")))))
                    .isInstanceOf(IncoherentStructureException.class)
                    .satisfies(e -> assertThat(((IncoherentStructureException) e).getOffenders())
                            .containsExactly("a->b"));
        }

        @Test
        void lenientKeepsPartialLinks() {
            Structure structure = compiler(CoherenceMode.LENIENT)
                    .resolve(mainOnly(ThinArrowRule.effectOnly(p("a"), p("b"))));

            assertThat(structure.getLink("a", "b")).map(l -> l.kind()).contains(LinkKind.EFFECT_ONLY);
            assertThat(structure.getWarnings()).extracting(ResolutionWarning::kind)
                    .containsExactly(WarningKind.INCOHERENT_NODE);
        }

        @Test
        @DisplayName("Replacing the policy applies to later resolutions")
        void replacePolicy() {
            StructureCompiler compiler = compiler(CoherenceMode.LENIENT);
            CesFile file = mainOnly(FatArrowRule.forward(p("a"), p("b")));
            compiler.resolve(file);

            compiler.setCoherencePolicy(CoherenceMode.STRICT.policy());

            assertThatThrownBy(() -> compiler.resolve(file)).isInstanceOf(IncoherentStructureException.class);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void duplicateStructureNames() {
            CesFile file = CesFile.of(
                    StructureDef.immediate("Main", FatArrowRule.forward(p("a"), p("b"))),
                    StructureDef.immediate("Main", FatArrowRule.forward(p("c"), p("d"))));

            assertThatThrownBy(() -> compiler(CoherenceMode.LENIENT).resolve(file))
                    .isInstanceOf(DuplicateNameException.class)
                    .hasMessageContaining("Main");
        }

        @Test
        @DisplayName("Capacity declared over a sum is not a node list")
        void capacityOverSum() {
            CesFile file = mainOnly(FatArrowRule.forward(p("a"), p("b"))).withContext(
                    new ContextDeclaration.CapacityDeclaration(Capacity.of(2), Polynomial.sum("a", "b"), null));

            assertThatThrownBy(() -> compiler(CoherenceMode.LENIENT).resolve(file))
                    .isInstanceOf(InvalidNodeListException.class);
        }

        @Test
        void missingRoot() {
            CesFile file = CesFile.of(StructureDef.immediate("Other", FatArrowRule.forward(p("a"), p("b"))));

            assertThatThrownBy(() -> compiler(CoherenceMode.LENIENT).resolve(file))
                    .isInstanceOf(UndefinedStructureException.class);
        }
    }

    @Nested
    @DisplayName("Stage reporting")
    class StageReporting {

        @Test
        void reportsEveryResolutionStage() {
            StructureCompiler compiler = compiler(CoherenceMode.LENIENT);
            CompilationListener listener = mock(CompilationListener.class);
            compiler.setCompilationListener(listener);

            compiler.resolve(mainOnly(FatArrowRule.forward(p("a"), p("b"))));

            InOrder order = inOrder(listener);
            order.verify(listener).onStageStart("REGISTRY", 2, 5);
            order.verify(listener).onStageComplete(eq("REGISTRY"), any(CompilationListener.StageResult.class));
            order.verify(listener).onStageStart("INSTANTIATION", 3, 5);
            order.verify(listener).onStageComplete(eq("INSTANTIATION"), any(CompilationListener.StageResult.class));
            order.verify(listener).onStageStart("CONTEXT_MERGE", 4, 5);
            order.verify(listener).onStageComplete(eq("CONTEXT_MERGE"), any(CompilationListener.StageResult.class));
            order.verify(listener).onStageStart("COHERENCE", 5, 5);
            order.verify(listener).onStageComplete(eq("COHERENCE"), any(CompilationListener.StageResult.class));
            verify(listener, never()).onError(any(), any());
        }

        @Test
        void reportsFailingStage() {
            StructureCompiler compiler = compiler(CoherenceMode.LENIENT);
            CompilationListener listener = mock(CompilationListener.class);
            compiler.setCompilationListener(listener);

            assertThatThrownBy(() -> compiler.resolve(mainOnly(StructureInstance.immediate("Missing"))))
                    .isInstanceOf(UndefinedStructureException.class);

            verify(listener).onError(eq("INSTANTIATION"), any(UndefinedStructureException.class));
            verify(listener, never()).onStageStart(eq("CONTEXT_MERGE"), eq(4), eq(5));
        }

        @Test
        void compileReportsLoadingStage(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("arrow.json");
            Files.writeString(file, """
                    {"structures": [{"name": "Main", "body": {"fat": {"head": "a", "steps": [{"op": "=>", "poly": "b"}]}}}]}
                    """);
            StructureCompiler compiler = compiler(CoherenceMode.LENIENT);
            CompilationListener listener = mock(CompilationListener.class);
            compiler.setCompilationListener(listener);

            Structure structure = compiler.compile(file);

            assertThat(structure.getLink("a", "b")).map(l -> l.kind()).contains(LinkKind.FULL);
            assertThat(structure.getStats().metadata()).containsEntry("origin", "arrow.json");
            verify(listener).onStageStart("LOADING", 1, 5);
            verify(listener).onStageComplete(eq("LOADING"), any(CompilationListener.StageResult.class));
        }
    }

    @Nested
    @DisplayName("Fixture files")
    class Fixtures {

        private Path fixture(String name) throws URISyntaxException {
            return Path.of(StructureCompilerTest.class.getResource("/fixtures/" + name).toURI());
        }

        @Test
        void resolvesPipelineWithContext() throws Exception {
            Structure structure = compiler(CoherenceMode.LENIENT).compile(fixture("pipeline.json"));

            assertThat(structure.getTitle()).contains("Three stage pipeline");
            assertThat(structure.getNodes()).extracting(CesNode::id)
                    .containsExactly("load", "parse", "emit", "done", "retry");
            assertThat(structure.getNode("load")).map(CesNode::label).contains("Load input");
            assertThat(structure.getNode("parse")).map(CesNode::capacity).contains(Capacity.of(4));
            assertThat(structure.getNode("done")).map(CesNode::capacity).contains(Capacity.unbounded());
            assertThat(structure.getLink("load", "parse")).hasValueSatisfying(link -> {
                assertThat(link.kind()).isEqualTo(LinkKind.FULL);
                assertThat(link.weight()).isEqualTo(3L);
            });
            assertThat(structure.getLink("parse", "emit")).map(l -> l.kind()).contains(LinkKind.FULL);
            assertThat(structure.getLink("emit", "done")).map(l -> l.kind()).contains(LinkKind.EFFECT_ONLY);
            assertThat(structure.getLink("emit", "retry")).map(l -> l.kind()).contains(LinkKind.EFFECT_ONLY);
            assertThat(structure.getInhibitors()).containsExactly(new InhibitorArc("load", "retry", Face.CAUSE));
            assertThat(structure.effectOf("emit")).isEqualTo(Polynomial.sum("done", "retry"));
            assertThat(structure.getWarnings()).containsExactly(new ResolutionWarning(WarningKind.INCOHERENT_NODE,
                    "load", "Node has incident links but only one of cause and effect is specified"));
            assertThat(structure.getStats().inhibitorCount()).isEqualTo(1);
            assertThat(structure.getStats().fullLinkCount()).isEqualTo(2);
        }

        @Test
        void reportsCycleWithInstantiationTrace() {
            assertThatThrownBy(() -> compiler(CoherenceMode.LENIENT).compile(fixture("cyclic.json")))
                    .isInstanceOf(CyclicInstantiationException.class)
                    .satisfies(e -> {
                        CyclicInstantiationException cycle = (CyclicInstantiationException) e;
                        assertThat(cycle.getCycle()).containsExactly("Ping", "Pong", "Ping");
                        assertThat(cycle.getInstantiationTrace()).containsExactly("Pong", "Ping", "Main");
                    });
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        void repeatedResolutionIsServedFromCache() {
            StructureCompiler compiler = new StructureCompiler(tracer, CompilerConfig.defaults());
            CesFile file = mainOnly(FatArrowRule.forward(p("a"), p("b")));

            Structure first = compiler.resolve(file);
            Structure second = compiler.resolve(mainOnly(FatArrowRule.forward(p("a"), p("b"))));

            assertThat(second).isSameAs(first);
            assertThat(compiler.getCache().stats().hitCount()).isEqualTo(1);
        }

        @Test
        void failedResolutionIsNotCached() {
            StructureCompiler compiler = new StructureCompiler(tracer, CompilerConfig.defaults());
            CesFile file = mainOnly(StructureInstance.immediate("Missing"));

            assertThatThrownBy(() -> compiler.resolve(file)).isInstanceOf(UndefinedStructureException.class);

            assertThat(compiler.getCache().getIfPresent(file)).isEmpty();
        }

        @Test
        @DisplayName("A parenthesized node list is not served the result of its plain twin")
        void parenthesizedNodeListIsNotACacheHit() {
            StructureCompiler compiler = new StructureCompiler(tracer, CompilerConfig.defaults());
            Rex body = FatArrowRule.forward(p("a"), p("b"));
            CesFile plain = mainOnly(body).withContext(
                    new ContextDeclaration.CapacityDeclaration(Capacity.of(2), Polynomial.product("a", "b"), null));
            CesFile grouped = mainOnly(body).withContext(new ContextDeclaration.CapacityDeclaration(
                    Capacity.of(2), Polynomial.product("a", "b").parenthesized(), null));

            assertThat(compiler.resolve(plain).getNode("a")).map(CesNode::capacity).contains(Capacity.of(2));
            assertThat(grouped).isNotEqualTo(plain);
            assertThatThrownBy(() -> compiler.resolve(grouped)).isInstanceOf(InvalidNodeListException.class);
        }

        @Test
        @DisplayName("Monomial order of the input survives a cached resolution of a reordered twin")
        void monomialOrderIsPartOfTheCacheKey() {
            StructureCompiler compiler = new StructureCompiler(tracer, CompilerConfig.defaults());

            Structure bc = compiler.resolve(mainOnly(FatArrowRule.forward(p("a"), Polynomial.sum("b", "c"))));
            Structure cb = compiler.resolve(mainOnly(FatArrowRule.forward(p("a"), Polynomial.sum("c", "b"))));

            assertThat(bc.effectOf("a")).hasToString("b + c");
            assertThat(cb.effectOf("a")).hasToString("c + b");
            assertThat(compiler.getCache().stats().hitCount()).isZero();
        }

        @Test
        void cacheCanBeDisabled() {
            assertThat(compiler(CoherenceMode.LENIENT).getCache()).isNull();
        }
    }
}
