package com.sitecraft.schedule;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a build cycle. Once cancelled no new task is dispatched; tasks already
 * running are left to finish.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
