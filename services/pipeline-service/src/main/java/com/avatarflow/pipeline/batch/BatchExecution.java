package com.avatarflow.pipeline.batch;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process bookkeeping for a running batch: how many units have resolved, how many were
 * skipped by cancellation, and whether the batch has been finalized.
 */
class BatchExecution {

    private final int requestedCount;
    private final AtomicInteger resolved = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();

    BatchExecution(int requestedCount) {
        this.requestedCount = requestedCount;
    }

    void cancel() {
        cancelled.set(true);
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return true when this call resolved the last unit
     */
    boolean resolveUnit() {
        return resolved.incrementAndGet() == requestedCount;
    }

    boolean skipUnit() {
        skipped.incrementAndGet();
        return resolveUnit();
    }

    int skippedCount() {
        return skipped.get();
    }

    boolean markFinished() {
        return finished.compareAndSet(false, true);
    }
}
