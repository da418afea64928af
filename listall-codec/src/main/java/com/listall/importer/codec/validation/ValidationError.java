/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.codec.validation;

/**
 * A single structural violation found in decoded import data.
 *
 * @param path    location in the payload, e.g. {@code lists[0].items[2].quantity}
 * @param message what is wrong
 */
public record ValidationError(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
