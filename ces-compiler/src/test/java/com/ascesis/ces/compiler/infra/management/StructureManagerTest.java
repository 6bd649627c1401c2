/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.infra.management;

import com.ascesis.ces.api.CompilationListener;
import com.ascesis.ces.api.IStructureCompiler;
import com.ascesis.ces.api.exceptions.CompilationException;
import com.ascesis.ces.api.model.Structure;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StructureManagerTest {

    @Mock
    private IStructureCompiler compiler;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @TempDir
    Path tempDir;

    private Path sourcePath;
    private final Structure initial = Structure.builder("Main").title("initial").build();
    private final Structure updated = Structure.builder("Main").title("updated").build();

    @BeforeEach
    void setUp() throws IOException {
        sourcePath = tempDir.resolve("main.json");
        Files.writeString(sourcePath, "{\"structures\": []}");

        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
    }

    private void touch() throws IOException {
        FileTime current = Files.getLastModifiedTime(sourcePath);
        Files.setLastModifiedTime(sourcePath, FileTime.fromMillis(current.toMillis() + 5_000));
    }

    @Test
    void compilesOnConstruction() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(initial);

        try (StructureManager manager = new StructureManager(sourcePath, tracer, compiler)) {
            assertThat(manager.getStructure()).isSameAs(initial);
        }
        verify(compiler).setTracer(tracer);
        verify(compiler).compile(sourcePath);
    }

    @Test
    void failsFastWhenInitialCompilationFails() throws Exception {
        when(compiler.compile(any(Path.class))).thenThrow(new CompilationException("Compilation failed"));

        assertThatThrownBy(() -> new StructureManager(sourcePath, tracer, compiler))
                .isInstanceOf(CompilationException.class);
    }

    @Test
    void reloadsWhenFileChanges() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(initial, updated);
        List<Structure> reloaded = new ArrayList<>();

        try (StructureManager manager = new StructureManager(sourcePath, tracer, compiler)) {
            manager.setReloadCallback(reloaded::add);
            touch();

            manager.checkForUpdates();

            assertThat(manager.getStructure()).isSameAs(updated);
        }
        assertThat(reloaded).containsExactly(updated);
        verify(compiler, times(2)).compile(sourcePath);
    }

    @Test
    void skipsUnchangedFile() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(initial);

        try (StructureManager manager = new StructureManager(sourcePath, tracer, compiler)) {
            manager.checkForUpdates();

            assertThat(manager.getStructure()).isSameAs(initial);
        }
        verify(compiler, times(1)).compile(sourcePath);
    }

    @Test
    void keepsPreviousStructureWhenReloadFails() throws Exception {
        when(compiler.compile(any(Path.class)))
                .thenReturn(initial)
                .thenThrow(new CompilationException("Reload failed"));

        try (StructureManager manager = new StructureManager(sourcePath, tracer, compiler)) {
            touch();

            manager.checkForUpdates();

            assertThat(manager.getStructure()).isSameAs(initial);
        }
        verify(compiler, times(2)).compile(sourcePath);
    }

    @Test
    void recompileReportsToListenerAndDetachesIt() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(initial, updated);
        CompilationListener listener = mock(CompilationListener.class);

        try (StructureManager manager = new StructureManager(sourcePath, tracer, compiler)) {
            manager.recompile(listener);

            assertThat(manager.getStructure()).isSameAs(updated);
        }
        InOrder order = inOrder(compiler);
        order.verify(compiler).setCompilationListener(listener);
        order.verify(compiler).compile(sourcePath);
        order.verify(compiler).setCompilationListener(null);
    }
}
