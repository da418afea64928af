/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api;

import com.listall.importer.api.model.ImportOptions;
import com.listall.importer.api.model.ImportPreview;
import com.listall.importer.api.model.ImportResult;

/**
 * Contract for importing list data into the entity store.
 *
 * <p>Raw input is either the JSON export format or free text with one item per
 * line. {@code preview} and {@code commit} run the same reconciliation, so they
 * report the same counters and conflicts for the same input, options and store
 * contents; only {@code commit} writes.
 *
 * <p>Failures surface as {@link com.listall.importer.api.exceptions.ImportException}.
 */
public interface IImportEngine {

    /**
     * Computes what an import would change without writing anything.
     *
     * @param rawInput the payload to import
     * @param options  merge strategy and validation switch
     * @param listener receives progress updates (use {@link ImportProgressListener#NONE} to ignore)
     * @param token    checked between lists
     * @return the preview
     */
    ImportPreview preview(byte[] rawInput, ImportOptions options,
                          ImportProgressListener listener, CancellationToken token);

    /**
     * Imports the payload and writes the result to the store as one unit.
     *
     * @param rawInput the payload to import
     * @param options  merge strategy and validation switch
     * @param listener receives progress updates (use {@link ImportProgressListener#NONE} to ignore)
     * @param token    checked between lists
     * @return the result of the committed import
     */
    ImportResult commit(byte[] rawInput, ImportOptions options,
                        ImportProgressListener listener, CancellationToken token);

    default ImportPreview preview(byte[] rawInput, ImportOptions options) {
        return preview(rawInput, options, ImportProgressListener.NONE, CancellationToken.none());
    }

    default ImportResult commit(byte[] rawInput, ImportOptions options) {
        return commit(rawInput, options, ImportProgressListener.NONE, CancellationToken.none());
    }
}
