/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

import java.util.Objects;

/**
 * Options for a single import call.
 *
 * @param mergeStrategy strategy used for the whole call
 * @param validateData  run the pre-flight validator and abort on any violation
 * @param textListName  name of the list that receives items parsed from free text
 */
public record ImportOptions(
        MergeStrategy mergeStrategy,
        boolean validateData,
        String textListName
) {

    public static final String DEFAULT_TEXT_LIST_NAME = "Imported List";

    public ImportOptions {
        Objects.requireNonNull(mergeStrategy, "mergeStrategy");
        if (textListName == null || textListName.isBlank()) {
            textListName = DEFAULT_TEXT_LIST_NAME;
        }
    }

    public ImportOptions(MergeStrategy mergeStrategy, boolean validateData) {
        this(mergeStrategy, validateData, DEFAULT_TEXT_LIST_NAME);
    }

    /** Merge with validation. */
    public static ImportOptions defaults() {
        return new ImportOptions(MergeStrategy.MERGE, true);
    }

    public static ImportOptions replace() {
        return new ImportOptions(MergeStrategy.REPLACE, true);
    }

    public static ImportOptions append() {
        return new ImportOptions(MergeStrategy.APPEND, true);
    }

    public ImportOptions withValidateData(boolean validate) {
        return new ImportOptions(mergeStrategy, validate, textListName);
    }

    public ImportOptions withTextListName(String name) {
        return new ImportOptions(mergeStrategy, validateData, name);
    }
}
