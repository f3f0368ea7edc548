package io.torotator.worker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;

/**
 * One Tor circuit and the Privoxy forwarder in front of it, exposed as a single backend port.
 */
public final class WorkerPair {
    private static final Logger LOG = LogManager.getLogger(WorkerPair.class);

    private final long id;
    private PairState state = PairState.ALLOCATING;
    private ManagedService circuit;
    private ManagedService forwarder;
    private Instant registeredAt;
    private RetireReason retireReason;
    private int launchAttempts;

    public WorkerPair(long id) {
        this.id = id;
    }

    public long id() {
        return id;
    }

    public synchronized PairState state() {
        return state;
    }

    public synchronized void transition(PairState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Pair " + id + ": illegal transition " + state + " -> " + next);
        }
        LOG.debug("Pair {}: {} -> {}", id, state, next);
        if (next == PairState.STARTING) {
            launchAttempts++;
        } else if (next == PairState.REGISTERED) {
            registeredAt = Instant.now();
        }
        state = next;
    }

    public synchronized void attach(ManagedService circuit, ManagedService forwarder) {
        this.circuit = circuit;
        this.forwarder = forwarder;
    }

    public synchronized ManagedService circuit() {
        return circuit;
    }

    public synchronized ManagedService forwarder() {
        return forwarder;
    }

    public synchronized void retiredBecause(RetireReason reason) {
        this.retireReason = reason;
    }

    public synchronized RetireReason retireReason() {
        return retireReason;
    }

    public synchronized int launchAttempts() {
        return launchAttempts;
    }

    public synchronized View view() {
        return new View(
                id,
                state.name(),
                circuit == null ? 0 : circuit.port(),
                forwarder == null ? 0 : forwarder.port(),
                circuit == null ? -1L : circuit.process().pid(),
                forwarder == null ? -1L : forwarder.process().pid(),
                registeredAt == null ? null : registeredAt.toString(),
                launchAttempts
        );
    }

    public record View(
            long id,
            String state,
            int circuitPort,
            int forwarderPort,
            long circuitPid,
            long forwarderPid,
            String registeredAt,
            int launchAttempts
    ) {
    }
}
