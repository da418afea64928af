/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

/**
 * Snapshot of import progress over the list/item hierarchy.
 *
 * @param totalLists       lists in the incoming payload
 * @param processedLists   lists fully processed so far
 * @param totalItems       items in the incoming payload
 * @param processedItems   items processed so far, skipped ones included
 * @param currentOperation short description, e.g. "Processing list 2 of 4"
 */
public record ImportProgress(
        int totalLists,
        int processedLists,
        int totalItems,
        int processedItems,
        String currentOperation
) {

    /**
     * Fraction of work done, clamped to [0, 1]; 0 when there is nothing to do.
     */
    public double overallProgress() {
        int total = totalLists + totalItems;
        if (total <= 0) {
            return 0.0;
        }
        double progress = (double) (processedLists + processedItems) / total;
        return Math.max(0.0, Math.min(1.0, progress));
    }

    public int progressPercentage() {
        return (int) (overallProgress() * 100);
    }
}
