/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api;

import com.listall.importer.api.model.ImportProgress;

/**
 * Callback for import progress.
 *
 * <p>Called synchronously on the importing thread, in the order the updates
 * are produced: {@code processedLists} and {@code processedItems} never
 * decrease within one call. Callers that render progress on another thread
 * are responsible for handing the update over.
 *
 * <h2>Usage</h2>
 * <pre>
 * ImportProgressListener listener = progress ->
 *     System.out.printf("%d%% %s%n", progress.progressPercentage(), progress.currentOperation());
 * engine.commit(payload, ImportOptions.defaults(), listener, CancellationToken.none());
 * </pre>
 */
@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NONE = progress -> { };

    /**
     * Called after each list and each item has been processed.
     *
     * @param progress the current progress
     */
    void onProgress(ImportProgress progress);
}
