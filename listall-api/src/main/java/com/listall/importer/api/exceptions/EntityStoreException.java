/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api.exceptions;

/**
 * Raised by {@link com.listall.importer.api.EntityStore} implementations when a
 * read or write cannot be carried out.
 */
public class EntityStoreException extends RuntimeException {

    public EntityStoreException(String message) {
        super(message);
    }

    public EntityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
