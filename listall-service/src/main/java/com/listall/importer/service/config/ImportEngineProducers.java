/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.service.config;

import com.listall.importer.api.EntityStore;
import com.listall.importer.api.IImportEngine;
import com.listall.importer.api.model.ImportOptions;
import com.listall.importer.codec.SchemaCodec;
import com.listall.importer.codec.export.ExportFormatter;
import com.listall.importer.engine.ImportEngine;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Dependent;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.util.UUID;

/**
 * CDI producers for import engine components.
 * Creates singleton instances of core services.
 */
@ApplicationScoped
public class ImportEngineProducers {

    @ConfigProperty(name = "listall.import.text-list-name", defaultValue = ImportOptions.DEFAULT_TEXT_LIST_NAME)
    String textListName;

    @ConfigProperty(name = "listall.tracing.instrumentation-name", defaultValue = "com.listall.importer")
    String instrumentationName;

    /**
     * Produces the OpenTelemetry Tracer from the globally registered SDK, or a
     * no-op tracer when none is registered.
     */
    @Produces
    @ApplicationScoped
    public Tracer tracer() {
        return GlobalOpenTelemetry.getTracer(instrumentationName);
    }

    @Produces
    @ApplicationScoped
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @ApplicationScoped
    public SchemaCodec schemaCodec() {
        return new SchemaCodec();
    }

    @Produces
    @ApplicationScoped
    public ExportFormatter exportFormatter() {
        return new ExportFormatter();
    }

    /**
     * Produces the import engine over whichever EntityStore is active.
     */
    @Produces
    @ApplicationScoped
    public IImportEngine importEngine(EntityStore entityStore, SchemaCodec schemaCodec, Tracer tracer, Clock clock) {
        return new ImportEngine(entityStore, schemaCodec, tracer, clock, UUID::randomUUID);
    }

    /**
     * Options used when a caller does not pass its own: merge, validated,
     * free text going to the configured list name.
     */
    @Produces
    @Dependent
    public ImportOptions defaultImportOptions() {
        return ImportOptions.defaults().withTextListName(textListName);
    }
}
