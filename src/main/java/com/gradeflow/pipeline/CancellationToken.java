package com.gradeflow.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Job-wide cancellation flag, checked by every pipeline at each state boundary
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return true if this call requested cancellation, false if it was already requested
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
