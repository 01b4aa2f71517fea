package com.avatarflow.pipeline.scheduling;

import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock for single-instance deployments.
 */
public class LocalDispatchLock implements DispatchLock {

    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public boolean tryAcquire() {
        return lock.tryLock();
    }

    @Override
    public boolean renew() {
        return lock.isHeldByCurrentThread();
    }

    @Override
    public void release() {
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }
}
