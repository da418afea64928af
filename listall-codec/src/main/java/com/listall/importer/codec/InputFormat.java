/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec;

/**
 * Shape of a raw import payload.
 */
public enum InputFormat {
    /** The JSON export format, decoded by {@link SchemaCodec}. */
    STRUCTURED,
    /** Loosely formatted text, one item per line. */
    FREE_TEXT
}
