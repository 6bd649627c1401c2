/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.infra.telemetry;

import com.ascesis.ces.api.ast.CesFile;
import com.ascesis.ces.api.ast.FatArrowRule;
import com.ascesis.ces.api.ast.Polynomial;
import com.ascesis.ces.api.ast.StructureDef;
import com.ascesis.ces.compiler.StructureCompiler;
import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TracingServiceTest {

    @Test
    void singletonProvidesTracer() {
        TracingService service = TracingService.getInstance();

        assertThat(TracingService.getInstance()).isSameAs(service);
        assertThat(service.getTracer()).isNotNull();
        assertThat(service.getOpenTelemetry()).isNotNull();

        Span span = service.getTracer().spanBuilder("resolve").startSpan();
        span.end();
    }

    @Test
    void defaultCompilerUsesProcessTracer() {
        StructureCompiler compiler = new StructureCompiler();

        assertThat(compiler.resolve(CesFile.of(StructureDef.immediate(compiler.getConfig().getRootName(),
                FatArrowRule.forward(Polynomial.of("a"), Polynomial.of("b"))))).getLinks()).hasSize(1);
    }
}
