package io.torotator.pool;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds the number of live worker pairs.
 */
public final class AdmissionGate {
    private static final long POLL_MS = 100L;

    private final int capacity;
    private final Semaphore slots;

    public AdmissionGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.slots = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a slot is free or shutdown is triggered.
     *
     * @return true if a slot was taken; false on shutdown or interrupt
     */
    public boolean acquire(ShutdownSignal shutdown) {
        while (!shutdown.isTriggered()) {
            try {
                if (slots.tryAcquire(POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    public void release() {
        slots.release();
    }

    public int capacity() {
        return capacity;
    }

    public int inUse() {
        return capacity - slots.availablePermits();
    }
}
