package io.torotator.pool;

import io.torotator.worker.RetireReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShutdownSignalTest {
    @Test
    void awaitTimesOutWhileNotTriggered() {
        ShutdownSignal signal = new ShutdownSignal();
        assertFalse(signal.await(Duration.ofMillis(50)));
        assertFalse(signal.isTriggered());
    }

    @Test
    void triggerWakesWaitersAndStaysTriggered() throws Exception {
        ShutdownSignal signal = new ShutdownSignal();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> signal.await(Duration.ofSeconds(30)));
        CompletableFuture<Void> observed = signal.subscribe();

        signal.trigger();
        signal.trigger();

        assertTrue(waiter.get(2, TimeUnit.SECONDS));
        observed.get(2, TimeUnit.SECONDS);
        assertTrue(signal.isTriggered());
        assertTrue(signal.await(Duration.ZERO));
    }

    @Test
    void completingASubscriptionDoesNotTrigger() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.subscribe().complete(null);
        assertFalse(signal.isTriggered());
    }

    @Test
    void lateSubscriberIsAlreadyComplete() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.trigger();
        assertTrue(signal.subscribe().isDone());
    }

    @Test
    void unsubscribedWaitersDoNotAccumulate() {
        ShutdownSignal signal = new ShutdownSignal();
        for (int i = 0; i < 1_000; i++) {
            CompletableFuture<Void> waiter = signal.subscribe();
            waiter.thenApply(v -> RetireReason.SHUTDOWN);
            signal.unsubscribe(waiter);
        }
        assertEquals(0, signal.subscribers());

        CompletableFuture<Void> kept = signal.subscribe();
        assertEquals(1, signal.subscribers());
        signal.trigger();
        assertTrue(kept.isDone());
    }
}
