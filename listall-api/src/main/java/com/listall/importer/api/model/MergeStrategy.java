/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.model;

/**
 * How incoming data is reconciled with the data already in the store.
 * Fixed for the whole of one import call.
 */
public enum MergeStrategy {
    /** Delete everything, then create all incoming entities with their own ids. */
    REPLACE,
    /** Update matching lists and items, create the rest; never deletes. */
    MERGE,
    /** Create every incoming entity under a freshly generated id. */
    APPEND
}
