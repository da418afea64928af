/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.service.service;

import com.listall.importer.api.CancellationToken;
import com.listall.importer.api.IImportEngine;
import com.listall.importer.api.ImportProgressListener;
import com.listall.importer.api.model.ImportOptions;
import com.listall.importer.api.model.ImportPreview;
import com.listall.importer.api.model.ImportResult;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Service for running imports off the caller's thread.
 *
 * <p>Work runs on one daemon thread named {@code list-import}. Only one
 * preview or import may be in flight at a time; a second request while one is
 * running fails at once instead of queueing.
 */
@ApplicationScoped
public class ImportService {

    private static final Logger logger = LoggerFactory.getLogger(ImportService.class);

    static final String THREAD_NAME = "list-import";

    @Inject
    IImportEngine importEngine;

    @Inject
    ImportOptions defaultOptions;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, THREAD_NAME);
        thread.setDaemon(true);
        return thread;
    });

    public ImportService() {
    }

    public ImportService(IImportEngine importEngine, ImportOptions defaultOptions) {
        this.importEngine = importEngine;
        this.defaultOptions = defaultOptions;
    }

    /**
     * Preview an import with the default options.
     */
    public CompletableFuture<ImportPreview> previewImport(byte[] data) {
        return previewImport(data, defaultOptions, ImportProgressListener.NONE, CancellationToken.none());
    }

    public CompletableFuture<ImportPreview> previewImport(byte[] data, ImportOptions options,
                                                         ImportProgressListener listener, CancellationToken token) {
        return submit("preview", () -> importEngine.preview(data, options, listener, token));
    }

    /**
     * Import with the default options.
     */
    public CompletableFuture<ImportResult> importData(byte[] data) {
        return importData(data, defaultOptions, ImportProgressListener.NONE, CancellationToken.none());
    }

    public CompletableFuture<ImportResult> importData(byte[] data, ImportOptions options,
                                                      ImportProgressListener listener, CancellationToken token) {
        return submit("import", () -> importEngine.commit(data, options, listener, token));
    }

    public boolean isImportInProgress() {
        return inProgress.get();
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private <T> CompletableFuture<T> submit(String operation, Supplier<T> work) {
        if (!inProgress.compareAndSet(false, true)) {
            logger.warn("Rejected {} request, another import is running", operation);
            throw new IllegalStateException("An import is already in progress");
        }

        logger.debug("Starting {}", operation);
        try {
            return CompletableFuture.supplyAsync(work, executor)
                    .whenComplete((result, error) -> {
                        inProgress.set(false);
                        if (error != null) {
                            logger.warn("{} failed: {}", operation, error.getMessage());
                        }
                    });
        } catch (RejectedExecutionException e) {
            inProgress.set(false);
            throw new IllegalStateException("Import service is shut down", e);
        }
    }
}
