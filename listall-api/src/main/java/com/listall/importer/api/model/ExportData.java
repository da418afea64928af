/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Root of the structured transport format.
 *
 * <h2>Wire form</h2>
 * <pre>
 * { "version": "1.0",
 *   "exportDate": "2025-10-01T08:30:00Z",
 *   "lists": [ { "id": "...", "name": "Groceries", ... "items": [ ... ] } ] }
 * </pre>
 *
 * <p>All three fields are required. They are kept nullable here so that a
 * decoder can report an explicit {@code null} as a decoding failure instead of
 * silently substituting a default.
 */
public record ExportData(
        @JsonProperty(value = "version", required = true) String version,
        @JsonProperty(value = "exportDate", required = true) Instant exportDate,
        @JsonProperty(value = "lists", required = true) List<ItemList> lists
) {

    public static final String CURRENT_VERSION = "1.0";

    public ExportData {
        if (lists != null) {
            lists = List.copyOf(lists);
        }
    }

    /**
     * Wraps lists in a current-version envelope stamped with the clock's instant.
     */
    public static ExportData of(List<ItemList> lists, Clock clock) {
        return new ExportData(CURRENT_VERSION, clock.instant(), lists);
    }

    public int totalItems() {
        return lists == null ? 0 : lists.stream().mapToInt(l -> l.items().size()).sum();
    }
}
