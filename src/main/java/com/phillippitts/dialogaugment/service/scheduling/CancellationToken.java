package com.phillippitts.dialogaugment.service.scheduling;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal. Set by the shutdown hook, polled by the scheduler between batches.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Requests cancellation.
     *
     * @return true if this call changed the state
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
