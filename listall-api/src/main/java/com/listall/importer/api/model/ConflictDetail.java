/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

import java.util.Optional;
import java.util.UUID;

/**
 * Informational record that an import will overwrite or remove a value.
 * Conflicts never block an import.
 *
 * @param type          kind of conflict
 * @param entityName    name or title of the affected entity, as currently stored
 * @param entityId      id of the affected entity
 * @param currentValue  current value (or summary) of the entity
 * @param incomingValue incoming value, {@code null} for deletions
 * @param message       human-readable description
 */
public record ConflictDetail(
        ConflictType type,
        String entityName,
        UUID entityId,
        String currentValue,
        String incomingValue,
        String message
) {

    public enum ConflictType {
        LIST_MODIFIED,
        ITEM_MODIFIED,
        LIST_DELETED,
        ITEM_DELETED
    }

    public Optional<String> incoming() {
        return Optional.ofNullable(incomingValue);
    }

    public boolean isDeletion() {
        return type == ConflictType.LIST_DELETED || type == ConflictType.ITEM_DELETED;
    }
}
