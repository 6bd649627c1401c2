/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler;

import com.ascesis.ces.api.CompilationListener;
import com.ascesis.ces.api.IStructureCompiler;
import com.ascesis.ces.api.ast.CesFile;
import com.ascesis.ces.api.exceptions.CompilationException;
import com.ascesis.ces.api.model.Link;
import com.ascesis.ces.api.model.ResolutionWarning;
import com.ascesis.ces.api.model.Structure;
import com.ascesis.ces.api.model.StructureStats;
import com.ascesis.ces.compiler.coherence.CoherenceChecker;
import com.ascesis.ces.compiler.coherence.CoherencePolicy;
import com.ascesis.ces.compiler.context.ContextMerger;
import com.ascesis.ces.compiler.derivation.PortLinkDeriver;
import com.ascesis.ces.compiler.fit.FitTransformer;
import com.ascesis.ces.compiler.infra.cache.ResolutionCache;
import com.ascesis.ces.compiler.infra.telemetry.TracingService;
import com.ascesis.ces.compiler.instantiation.Instantiator;
import com.ascesis.ces.compiler.loader.CesFileLoader;
import com.ascesis.ces.compiler.model.Fragment;
import com.ascesis.ces.compiler.registry.StructureRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Resolves the root structure of a file into one canonical {@link Structure}.
 *
 * <p>The pipeline:
 * <ol>
 *   <li>Load the JSON AST ({@link #compile(Path)} only).</li>
 *   <li>Register definitions, rejecting duplicate names.</li>
 *   <li>Instantiate the root structure, expanding fat rules through FIT and
 *       deriving ports and links from every thin rule.</li>
 *   <li>Merge context declarations.</li>
 *   <li>Check coherence against the configured policy.</li>
 * </ol>
 * Resolution is all-or-nothing: any {@link CompilationException} aborts it
 * and no partial structure is returned. The compiler keeps no per-file state,
 * so distinct files may be resolved concurrently.
 */
public class StructureCompiler implements IStructureCompiler {
    private static final Logger logger = Logger.getLogger(StructureCompiler.class.getName());

    private static final int TOTAL_STAGES = 5;

    private final CompilerConfig config;
    private final CesFileLoader loader;
    private final FitTransformer fitTransformer;
    private final PortLinkDeriver deriver = new PortLinkDeriver();
    private final ContextMerger contextMerger = new ContextMerger();
    private final ResolutionCache cache;

    private volatile Tracer tracer;
    private volatile CompilationListener listener;
    private volatile CoherenceChecker coherenceChecker;

    /**
     * Compiler traced by the process-wide {@link TracingService} and configured from the environment.
     */
    public StructureCompiler() {
        this(TracingService.getInstance().getTracer());
    }

    public StructureCompiler(Tracer tracer) {
        this(tracer, CompilerConfig.fromEnvironment());
    }

    public StructureCompiler(Tracer tracer, CompilerConfig config) {
        this(tracer, config, new CesFileLoader());
    }

    public StructureCompiler(Tracer tracer, CompilerConfig config, CesFileLoader loader) {
        this.tracer = tracer;
        this.config = config;
        this.loader = loader;
        this.fitTransformer = new FitTransformer(config.getMaxFitIterations());
        this.coherenceChecker = new CoherenceChecker(config.getCoherenceMode().policy());
        this.cache = config.isCacheEnabled() ? new ResolutionCache(config.getCacheMaxSize()) : null;
        logger.fine(() -> "Structure compiler created: " + config);
    }

    @Override
    public Structure compile(Path path) throws IOException {
        Span span = tracer.spanBuilder("compile-structure-file").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("filePath", path.toString());
            notifyStart("LOADING", 1);
            long start = System.nanoTime();
            CesFile file;
            try {
                file = loader.load(path);
            } catch (IOException | RuntimeException e) {
                notifyError("LOADING", e);
                throw e;
            }
            notifyComplete("LOADING", start, Map.of("structureCount", file.structures().size(),
                    "contextDeclarationCount", file.context().size()));
            return resolve(file);
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Structure resolve(CesFile file) {
        if (cache != null) {
            return cache.get(file, this::resolveUncached);
        }
        return resolveUncached(file);
    }

    private Structure resolveUncached(CesFile file) {
        Span span = tracer.spanBuilder("resolve-structure").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            String rootName = config.getRootName();
            span.setAttribute("origin", file.origin());
            span.setAttribute("rootName", rootName);

            StructureRegistry registry = stage("REGISTRY", 2,
                    () -> StructureRegistry.of(file.structures()),
                    r -> Map.of("structureCount", r.size()));

            Instantiator instantiator = new Instantiator(registry, fitTransformer, deriver);
            Fragment fragment = stage("INSTANTIATION", 3,
                    () -> instantiator.instantiateRoot(rootName),
                    f -> Map.of("nodeCount", f.nodes().size(),
                            "linkCount", f.links().size(),
                            "instantiations", instantiator.instantiations(),
                            "fitMergeSteps", instantiator.fitMergeSteps()));

            Structure merged = stage("CONTEXT_MERGE", 4,
                    () -> contextMerger.merge(fragment.toStructure(rootName).build(), file.context()),
                    s -> Map.of("inhibitorCount", s.getInhibitors().size(),
                            "warningCount", s.getWarnings().size()));

            CoherenceChecker checker = coherenceChecker;
            List<ResolutionWarning> coherenceWarnings = stage("COHERENCE", 5,
                    () -> checker.check(merged),
                    w -> Map.of("warningCount", w.size()));

            long resolutionTime = System.nanoTime() - startTime;
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("origin", file.origin());
            metadata.put("structureCount", registry.size());
            metadata.put("coherencePolicy", checker.getPolicy().getClass().getSimpleName());

            int fullLinks = (int) merged.getLinks().stream().filter(Link::isFull).count();
            StructureStats stats = new StructureStats(
                    merged.getNodes().size(),
                    merged.getLinks().size(),
                    fullLinks,
                    merged.getInhibitors().size(),
                    instantiator.instantiations(),
                    instantiator.fitMergeSteps(),
                    resolutionTime,
                    metadata);
            Structure result = merged.withWarnings(coherenceWarnings, stats);

            span.setAttribute("nodeCount", stats.nodeCount());
            span.setAttribute("linkCount", stats.linkCount());
            span.setAttribute("resolutionTimeMs", TimeUnit.NANOSECONDS.toMillis(resolutionTime));
            logger.info(String.format("Resolved '%s' from %s: %d nodes, %d links (%d full), %d warning(s)",
                    rootName, file.origin(), stats.nodeCount(), stats.linkCount(), fullLinks,
                    result.getWarnings().size()));
            return result;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> T stage(String name, int number, Supplier<T> work, Function<T, Map<String, Object>> metrics) {
        Span span = tracer.spanBuilder(name.toLowerCase().replace('_', '-')).startSpan();
        try (Scope scope = span.makeCurrent()) {
            notifyStart(name, number);
            long start = System.nanoTime();
            T result = work.get();
            notifyComplete(name, start, metrics.apply(result));
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            notifyError(name, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void notifyStart(String stage, int number) {
        CompilationListener current = listener;
        if (current != null) {
            current.onStageStart(stage, number, TOTAL_STAGES);
        }
    }

    private void notifyComplete(String stage, long startNanos, Map<String, Object> metrics) {
        CompilationListener current = listener;
        if (current != null) {
            current.onStageComplete(stage,
                    new CompilationListener.StageResult(stage, System.nanoTime() - startNanos, metrics));
        }
    }

    private void notifyError(String stage, Exception error) {
        CompilationListener current = listener;
        if (current != null) {
            current.onError(stage, error);
        }
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    /**
     * Replaces the coherence policy chosen by {@link CompilerConfig#getCoherenceMode()}.
     * Cached structures are discarded.
     */
    public void setCoherencePolicy(CoherencePolicy policy) {
        this.coherenceChecker = new CoherenceChecker(policy);
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    public CompilerConfig getConfig() {
        return config;
    }

    /**
     * @return the resolution cache, or {@code null} when caching is disabled
     */
    public ResolutionCache getCache() {
        return cache;
    }
}
