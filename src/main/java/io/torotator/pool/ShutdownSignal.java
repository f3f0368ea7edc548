package io.torotator.pool;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Process-wide cooperative cancellation. Once triggered it stays triggered.
 *
 * <p>Long-lived waiters take their own future via {@link #subscribe()} and hand it back with
 * {@link #unsubscribe(CompletableFuture)}, so nothing accumulates on the signal while pairs rotate.
 */
public final class ShutdownSignal {
    private final CompletableFuture<Void> triggered = new CompletableFuture<>();
    private final Set<CompletableFuture<Void>> waiters = ConcurrentHashMap.newKeySet();

    public void trigger() {
        triggered.complete(null);
        for (CompletableFuture<Void> waiter : waiters) {
            waiter.complete(null);
        }
    }

    public boolean isTriggered() {
        return triggered.isDone();
    }

    /**
     * A fresh future that completes on shutdown, already completed if shutdown happened.
     */
    public CompletableFuture<Void> subscribe() {
        CompletableFuture<Void> waiter = new CompletableFuture<>();
        waiters.add(waiter);
        // trigger() may have walked the set before the add
        if (triggered.isDone()) {
            waiter.complete(null);
        }
        return waiter;
    }

    public void unsubscribe(CompletableFuture<Void> waiter) {
        waiters.remove(waiter);
    }

    int subscribers() {
        return waiters.size();
    }

    /**
     * Sleeps up to {@code timeout}, waking early on shutdown.
     *
     * @return true if shutdown was triggered, also when the wait was interrupted
     */
    public boolean await(Duration timeout) {
        try {
            triggered.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } catch (ExecutionException e) {
            throw new IllegalStateException("shutdown signal failed", e);
        }
    }
}
