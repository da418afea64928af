/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.engine;

import com.listall.importer.api.CancellationToken;
import com.listall.importer.api.EntityStore;
import com.listall.importer.api.IImportEngine;
import com.listall.importer.api.ImportProgressListener;
import com.listall.importer.api.exceptions.ImportException;
import com.listall.importer.api.model.ExportData;
import com.listall.importer.api.model.ImportOptions;
import com.listall.importer.api.model.ImportPreview;
import com.listall.importer.api.model.ImportResult;
import com.listall.importer.api.model.ItemList;
import com.listall.importer.codec.ImportPayloadReader;
import com.listall.importer.codec.SchemaCodec;
import com.listall.importer.codec.validation.ExportDataValidator;
import com.listall.importer.codec.validation.ValidationError;
import com.listall.importer.engine.commit.CommitCoordinator;
import com.listall.importer.engine.reconcile.ChangeSet;
import com.listall.importer.engine.reconcile.ReconciliationEngine;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Default {@link IImportEngine}.
 *
 * <p>Both operations share one planning path: read the payload, validate it
 * when asked to, snapshot the store and reconcile. A preview stops there; a
 * commit hands the plan to the {@link CommitCoordinator}. For the same payload,
 * options and store state, the preview's counters equal the commit's.
 */
public class ImportEngine implements IImportEngine {

    private static final Logger logger = LoggerFactory.getLogger(ImportEngine.class);

    private final EntityStore entityStore;
    private final ImportPayloadReader payloadReader;
    private final ExportDataValidator validator;
    private final ReconciliationEngine reconciliationEngine;
    private final CommitCoordinator commitCoordinator;
    private final Tracer tracer;

    public ImportEngine(EntityStore entityStore, Tracer tracer) {
        this(entityStore, new SchemaCodec(), tracer, Clock.systemUTC(), UUID::randomUUID);
    }

    public ImportEngine(EntityStore entityStore,
                        SchemaCodec schemaCodec,
                        Tracer tracer,
                        Clock clock,
                        Supplier<UUID> idGenerator) {
        this(entityStore,
                new ImportPayloadReader(schemaCodec, clock, idGenerator),
                new ExportDataValidator(),
                new ReconciliationEngine(tracer, idGenerator),
                new CommitCoordinator(entityStore, tracer),
                tracer);
    }

    ImportEngine(EntityStore entityStore,
                 ImportPayloadReader payloadReader,
                 ExportDataValidator validator,
                 ReconciliationEngine reconciliationEngine,
                 CommitCoordinator commitCoordinator,
                 Tracer tracer) {
        this.entityStore = entityStore;
        this.payloadReader = payloadReader;
        this.validator = validator;
        this.reconciliationEngine = reconciliationEngine;
        this.commitCoordinator = commitCoordinator;
        this.tracer = tracer;
    }

    @Override
    public ImportPreview preview(byte[] rawInput, ImportOptions options,
                                 ImportProgressListener listener, CancellationToken token) {
        Span span = tracer.spanBuilder("import-preview").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("strategy", options.mergeStrategy().name());
            ChangeSet changeSet = plan(rawInput, options, listener, token);
            ImportPreview preview = changeSet.toPreview();
            span.setAttribute("totalChanges", preview.totalChanges());
            logger.info("Import preview: {} lists to create, {} to update, {} items to create, {} to update, {} conflicts",
                    preview.listsToCreate(), preview.listsToUpdate(), preview.itemsToCreate(),
                    preview.itemsToUpdate(), preview.conflicts().size());
            return preview;
        } catch (ImportException e) {
            span.recordException(e);
            logger.warn("Import preview failed: {}", e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public ImportResult commit(byte[] rawInput, ImportOptions options,
                               ImportProgressListener listener, CancellationToken token) {
        Span span = tracer.spanBuilder("import-commit").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("strategy", options.mergeStrategy().name());
            ChangeSet changeSet = plan(rawInput, options, listener, token);
            if (token != null && token.isCancellationRequested()) {
                throw ImportException.cancelled();
            }
            ImportResult result = commitCoordinator.commit(changeSet);
            span.setAttribute("totalChanges", result.totalChanges());
            logger.info("Import committed with {}: {} lists created, {} updated, {} items created, {} updated",
                    options.mergeStrategy(), result.listsCreated(), result.listsUpdated(),
                    result.itemsCreated(), result.itemsUpdated());
            return result;
        } catch (ImportException e) {
            span.recordException(e);
            logger.warn("Import failed: {}", e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private ChangeSet plan(byte[] rawInput, ImportOptions options,
                           ImportProgressListener listener, CancellationToken token) {
        ExportData incoming = payloadReader.read(rawInput, options.textListName());

        if (options.validateData()) {
            List<ValidationError> errors = validator.validate(incoming);
            if (!errors.isEmpty()) {
                throw ImportException.validationFailed(errors.stream()
                        .map(ValidationError::message)
                        .collect(Collectors.joining("; ")));
            }
        }

        return reconciliationEngine.reconcile(snapshot(), incoming, options.mergeStrategy(), listener, token);
    }

    private List<ItemList> snapshot() {
        try {
            return entityStore.findAllLists();
        } catch (RuntimeException e) {
            logger.error("Could not read the current lists", e);
            throw ImportException.repositoryError("could not read existing lists", e);
        }
    }
}
