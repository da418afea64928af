/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.engine.progress;

import com.listall.importer.api.ImportProgressListener;
import com.listall.importer.api.model.ImportProgress;

/**
 * Turns traversal steps into {@link ImportProgress} updates.
 *
 * <p>One reporter serves one traversal. Counters only move forward and never
 * pass their totals, so successive updates are monotonic. Updates are handed
 * to the listener synchronously, in the order they are produced.
 */
public class ProgressReporter {

    private final ImportProgressListener listener;
    private final int totalLists;
    private final int totalItems;

    private int processedLists;
    private int processedItems;

    public ProgressReporter(ImportProgressListener listener, int totalLists, int totalItems) {
        this.listener = listener != null ? listener : ImportProgressListener.NONE;
        this.totalLists = Math.max(0, totalLists);
        this.totalItems = Math.max(0, totalItems);
    }

    /**
     * Records one processed item (created, updated or skipped).
     */
    public void itemProcessed() {
        itemsProcessed(1);
    }

    /**
     * Records several items at once, e.g. the items of a skipped list.
     */
    public void itemsProcessed(int count) {
        if (count <= 0) {
            return;
        }
        processedItems = Math.min(totalItems, processedItems + count);
        publish("Processing item " + processedItems + " of " + totalItems);
    }

    /**
     * Records one fully processed list.
     */
    public void listProcessed() {
        processedLists = Math.min(totalLists, processedLists + 1);
        publish("Processing list " + processedLists + " of " + totalLists);
    }

    /**
     * Publishes the final update of a completed traversal.
     */
    public void complete() {
        publish(totalLists + totalItems == 0 ? "Nothing to import" : "Import complete");
    }

    public ImportProgress current(String operation) {
        return new ImportProgress(totalLists, processedLists, totalItems, processedItems, operation);
    }

    private void publish(String operation) {
        listener.onProgress(current(operation));
    }
}
