package com.avatarflow.pipeline.scheduling;

/**
 * Ensures a single dispatch sweep runs at a time.
 */
public interface DispatchLock {

    /**
     * @return false when another sweep holds the lock; the caller skips this tick
     */
    boolean tryAcquire();

    /**
     * Extends the hold before the next publish.
     *
     * @return false when the lock is no longer ours; the caller must stop publishing
     */
    boolean renew();

    void release();
}
