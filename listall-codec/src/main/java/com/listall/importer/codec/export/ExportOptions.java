/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec.export;

/**
 * What to include in a plain-text export.
 */
public record ExportOptions(
        boolean includeCrossedOutItems,
        boolean includeDescriptions,
        boolean includeQuantities,
        boolean includeDates
) {

    public static ExportOptions defaults() {
        return new ExportOptions(true, true, true, false);
    }

    /** Titles only, open items only. */
    public static ExportOptions minimal() {
        return new ExportOptions(false, false, false, false);
    }
}
