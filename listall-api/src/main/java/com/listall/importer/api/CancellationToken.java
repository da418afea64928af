/*
 * Copyright (c) 2025 ListAll Import Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.listall.importer.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller and a running import.
 *
 * <p>The importer checks it between top-level lists. Once honoured, the
 * partially built change-set is discarded and nothing is written.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Returns a fresh token that has not been cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
