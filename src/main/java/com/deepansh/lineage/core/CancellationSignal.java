package com.deepansh.lineage.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller stop a running query. The loop checks it between phases; a
 * phase already in flight runs to completion (bounded by its own timeouts).
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
