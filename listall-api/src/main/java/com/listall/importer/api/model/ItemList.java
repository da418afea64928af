/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A named list of items.
 *
 * <p>Every item in {@code items} belongs to this list. {@code orderNumber} is the
 * display position and is not required to be unique.
 */
public record ItemList(
        @JsonProperty(value = "id", required = true) UUID id,
        @JsonProperty(value = "name", required = true) String name,
        @JsonProperty(value = "orderNumber", required = true) int orderNumber,
        @JsonProperty(value = "isArchived", required = true) boolean isArchived,
        @JsonProperty(value = "createdAt", required = true) Instant createdAt,
        @JsonProperty(value = "modifiedAt", required = true) Instant modifiedAt,
        @JsonProperty("items") List<Item> items
) {

    public ItemList {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public ItemList withId(UUID newId) {
        return new ItemList(newId, name, orderNumber, isArchived, createdAt, modifiedAt, items);
    }

    public ItemList withItems(List<Item> newItems) {
        return new ItemList(id, name, orderNumber, isArchived, createdAt, modifiedAt, newItems);
    }

    /**
     * Returns a copy carrying only the list's own fields, as written to the store.
     */
    public ItemList withoutItems() {
        return withItems(List.of());
    }
}
