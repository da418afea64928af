/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

import java.util.List;

/**
 * Outcome of a dry run: what a commit with the same input and options would do.
 */
public record ImportPreview(
        int listsToCreate,
        int listsToUpdate,
        int itemsToCreate,
        int itemsToUpdate,
        List<ConflictDetail> conflicts,
        List<String> errors
) {

    public ImportPreview {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public int totalChanges() {
        return listsToCreate + listsToUpdate + itemsToCreate + itemsToUpdate;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
