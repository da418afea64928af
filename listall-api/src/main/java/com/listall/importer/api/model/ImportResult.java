/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

import java.util.List;

/**
 * Outcome of a committed import.
 *
 * <p>{@code errors} lists the entities that were skipped during traversal. A
 * result with errors is still a completed import; {@link #wasSuccessful()}
 * tells the two cases apart.
 */
public record ImportResult(
        int listsCreated,
        int listsUpdated,
        int itemsCreated,
        int itemsUpdated,
        List<ConflictDetail> conflicts,
        List<String> errors
) {

    public ImportResult {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public int totalChanges() {
        return listsCreated + listsUpdated + itemsCreated + itemsUpdated;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public boolean wasSuccessful() {
        return errors.isEmpty();
    }
}
