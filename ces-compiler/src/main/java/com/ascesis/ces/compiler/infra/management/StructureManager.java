/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.infra.management;

import com.ascesis.ces.api.CompilationListener;
import com.ascesis.ces.api.IStructureCompiler;
import com.ascesis.ces.api.exceptions.CompilationException;
import com.ascesis.ces.api.model.Structure;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the structure compiled from one file current.
 *
 * <p>The active structure is swapped atomically, so readers always see a
 * complete structure. When the file changes and the new version fails to
 * compile, the previous structure stays active.
 */
public class StructureManager implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StructureManager.class.getName());

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    private final Path sourcePath;
    private final IStructureCompiler compiler;
    private final Tracer tracer;
    private final AtomicReference<Structure> activeStructure = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;
    private volatile Consumer<Structure> reloadCallback;

    /**
     * Compiles the file once, failing fast if it does not resolve.
     */
    public StructureManager(Path sourcePath, Tracer tracer, IStructureCompiler compiler) throws IOException {
        this.sourcePath = sourcePath;
        this.tracer = tracer;
        this.compiler = compiler;
        this.compiler.setTracer(tracer);
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("ces-file-monitor-%d")
                .setDaemon(true)
                .build());

        reloadInternal();
    }

    public Structure getStructure() {
        return activeStructure.get();
    }

    /**
     * Callback run after every successful reload with the new structure.
     */
    public void setReloadCallback(Consumer<Structure> callback) {
        this.reloadCallback = callback;
    }

    public void start() {
        start(DEFAULT_POLL_INTERVAL);
    }

    public void start(Duration pollInterval) {
        long millis = pollInterval.toMillis();
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, millis, millis, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Recompiles immediately, reporting stage events to the listener.
     *
     * @throws CompilationException if the file does not resolve; the previous structure stays active
     */
    public void recompile(CompilationListener listener) throws IOException {
        Span span = tracer.spanBuilder("manual-recompile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            compiler.setCompilationListener(listener);
            try {
                reloadInternal();
            } finally {
                compiler.setCompilationListener(null);
            }
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * One poll of the watched file; compiles it if it changed since the last successful load.
     */
    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-structure-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("sourceFile", sourcePath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(sourcePath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in " + sourcePath + ". Attempting to reload...");
                reloadKeepingPrevious();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check " + sourcePath + " for modifications.", e);
        } finally {
            span.end();
        }
    }

    private void reloadKeepingPrevious() {
        try {
            reloadInternal();
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to compile new structure. Previous structure remains active.", e);
        }
    }

    private void reloadInternal() throws IOException {
        Span span = tracer.spanBuilder("load-new-structure").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(sourcePath).toMillis();
            Structure structure = compiler.compile(sourcePath);
            activeStructure.set(structure);
            this.lastModifiedTime = modifiedTime;
            span.setAttribute("structure.nodeCount", structure.getNodes().size());
            logger.info("Successfully compiled and swapped to structure '" + structure.getName() + "'.");

            Consumer<Structure> callback = reloadCallback;
            if (callback != null) {
                callback.accept(structure);
            }
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
