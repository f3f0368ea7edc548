package io.torotator.pool;

import io.torotator.haproxy.BackendRegistry;
import io.torotator.port.PortAllocator;
import io.torotator.port.PortExhaustedException;
import io.torotator.process.LaunchException;
import io.torotator.worker.ManagedService;
import io.torotator.worker.PairState;
import io.torotator.worker.PrivoxyForwarder;
import io.torotator.worker.RetireReason;
import io.torotator.worker.TorCircuit;
import io.torotator.worker.WorkerPair;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps up to {@code capacity} Tor+Privoxy pairs alive. When a pair expires or one of its processes
 * dies it is retired and a new pair takes its slot. {@link #run()} blocks until shutdown is
 * triggered and every live pair has retired.
 */
public final class RotationScheduler {
    private static final Logger LOG = LogManager.getLogger(RotationScheduler.class);

    private final AdmissionGate gate;
    private final Duration maxLifetime;
    private final Duration launchBackoff;
    private final PortAllocator ports;
    private final BackendRegistry registry;
    private final TorCircuit circuits;
    private final PrivoxyForwarder forwarders;
    private final ShutdownSignal shutdown;
    private final Executor drainExecutor;
    private final ExecutorService pairExecutor;

    // unbounded join over every pair task ever started; the gate bounds the live ones
    private final Phaser pairTasks = new Phaser(1);
    private final ConcurrentMap<Long, WorkerPair> livePairs = new ConcurrentHashMap<>();
    private final AtomicLong pairSequence = new AtomicLong(0L);
    private final AtomicLong pairsRegistered = new AtomicLong(0L);
    private final AtomicLong launchFailures = new AtomicLong(0L);
    private final Map<RetireReason, AtomicLong> retired = new EnumMap<>(RetireReason.class);

    public RotationScheduler(
            int capacity,
            Duration maxLifetime,
            Duration launchBackoff,
            PortAllocator ports,
            BackendRegistry registry,
            TorCircuit circuits,
            PrivoxyForwarder forwarders,
            ShutdownSignal shutdown,
            Executor drainExecutor
    ) {
        this.gate = new AdmissionGate(capacity);
        this.maxLifetime = maxLifetime;
        this.launchBackoff = launchBackoff;
        this.ports = ports;
        this.registry = registry;
        this.circuits = circuits;
        this.forwarders = forwarders;
        this.shutdown = shutdown;
        this.drainExecutor = drainExecutor;
        AtomicInteger threadSeq = new AtomicInteger(0);
        this.pairExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-pair-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (RetireReason reason : RetireReason.values()) {
            retired.put(reason, new AtomicLong(0L));
        }
    }

    public void run() {
        LOG.info("Rotating up to {} pairs, max lifetime {}s", gate.capacity(), maxLifetime.toSeconds());
        while (!shutdown.isTriggered()) {
            if (!gate.acquire(shutdown)) {
                break;
            }
            if (shutdown.isTriggered()) {
                gate.release();
                break;
            }
            long id = pairSequence.incrementAndGet();
            pairTasks.register();
            try {
                pairExecutor.execute(() -> {
                    try {
                        runPair(new WorkerPair(id));
                    } catch (RuntimeException e) {
                        LOG.error("Pair {} failed unexpectedly", id, e);
                    } finally {
                        gate.release();
                        pairTasks.arriveAndDeregister();
                    }
                });
            } catch (RejectedExecutionException e) {
                gate.release();
                pairTasks.arriveAndDeregister();
                LOG.error("Cannot schedule pair {}", id, e);
                break;
            }
        }

        LOG.info("Stopped admitting pairs, waiting for {} live pair(s) to retire", livePairs.size());
        pairTasks.arriveAndAwaitAdvance();
        pairExecutor.shutdown();
        LOG.info("All pairs retired");
    }

    private void runPair(WorkerPair pair) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("pair", Long.toString(pair.id()))) {
            livePairs.put(pair.id(), pair);
            try {
                if (!startProcesses(pair)) {
                    pair.transition(PairState.DONE);
                    return;
                }
                ManagedService circuit = pair.circuit();
                ManagedService forwarder = pair.forwarder();
                try (CloseableThreadContext.Instance portContext = CloseableThreadContext
                        .put("tor", Integer.toString(circuit.port()))
                        .put("privoxy", Integer.toString(forwarder.port()))) {
                    RetireReason reason;
                    try {
                        pair.transition(PairState.REGISTERED);
                        registry.register(forwarder.port());
                        pairsRegistered.incrementAndGet();
                        drainExecutor.execute(circuit.process()::drain);
                        drainExecutor.execute(forwarder.process()::drain);
                        LOG.info("Proxy started");
                        reason = awaitRetirement(circuit, forwarder);
                    } catch (RuntimeException e) {
                        LOG.warn("Tearing down proxy after failure: {}", e.toString());
                        retire(circuit, forwarder);
                        throw e;
                    }
                    pair.retiredBecause(reason);
                    retired.get(reason).incrementAndGet();
                    pair.transition(PairState.RETIRING);
                    LOG.info("Stopping proxy: {}", reason);
                    retire(circuit, forwarder);
                    pair.transition(PairState.DONE);
                    LOG.info("Proxy terminated");
                }
            } finally {
                livePairs.remove(pair.id());
            }
        }
    }

    /**
     * Drives ALLOCATING/STARTING until both processes run. Returns false on shutdown, with nothing
     * left running and no ports leased.
     */
    private boolean startProcesses(WorkerPair pair) {
        while (!shutdown.isTriggered()) {
            int circuitPort;
            try {
                circuitPort = ports.lease();
            } catch (PortExhaustedException e) {
                LOG.warn("Cannot lease circuit port: {}", e.getMessage());
                if (shutdown.await(launchBackoff)) {
                    return false;
                }
                continue;
            }
            pair.transition(PairState.STARTING);

            ManagedService circuit;
            try {
                circuit = circuits.launch(circuitPort);
            } catch (LaunchException e) {
                ports.release(circuitPort);
                if (retryAfterFailure(pair, e)) {
                    continue;
                }
                return false;
            }

            ManagedService forwarder;
            int forwarderPort = 0;
            try {
                forwarderPort = ports.lease();
                forwarder = forwarders.launch(forwarderPort, circuitPort);
            } catch (LaunchException | PortExhaustedException e) {
                circuit.close();
                ports.release(circuitPort);
                if (forwarderPort > 0) {
                    ports.release(forwarderPort);
                }
                if (retryAfterFailure(pair, e)) {
                    continue;
                }
                return false;
            }

            if (shutdown.isTriggered()) {
                forwarder.close();
                circuit.close();
                ports.release(forwarderPort);
                ports.release(circuitPort);
                return false;
            }
            pair.attach(circuit, forwarder);
            return true;
        }
        return false;
    }

    private boolean retryAfterFailure(WorkerPair pair, Exception e) {
        launchFailures.incrementAndGet();
        LOG.error("Failed to start pair {} (attempt {}), retrying in {}ms",
                pair.id(), pair.launchAttempts(), launchBackoff.toMillis(), e);
        pair.transition(PairState.ALLOCATING);
        return !shutdown.await(launchBackoff);
    }

    private RetireReason awaitRetirement(ManagedService circuit, ManagedService forwarder) {
        CompletableFuture<Void> stop = shutdown.subscribe();
        CompletableFuture<Object> first = CompletableFuture.anyOf(
                stop.thenApply(v -> RetireReason.SHUTDOWN),
                circuit.process().exited().thenApply(v -> RetireReason.CIRCUIT_EXITED),
                forwarder.process().exited().thenApply(v -> RetireReason.FORWARDER_EXITED)
        );
        try {
            return (RetireReason) first.get(maxLifetime.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return RetireReason.EXPIRED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetireReason.SHUTDOWN;
        } catch (ExecutionException e) {
            LOG.error("Retirement wait failed", e);
            return RetireReason.EXPIRED;
        } finally {
            shutdown.unsubscribe(stop);
        }
    }

    /**
     * Deregisters first, so HAProxy stops routing to the forwarder before it goes away.
     */
    private void retire(ManagedService circuit, ManagedService forwarder) {
        registry.deregister(forwarder.port());
        forwarder.close();
        circuit.close();
        ports.release(forwarder.port());
        ports.release(circuit.port());
    }

    public List<WorkerPair.View> livePairs() {
        return livePairs.values().stream()
                .map(WorkerPair::view)
                .sorted(Comparator.comparingLong(WorkerPair.View::id))
                .toList();
    }

    public int capacity() {
        return gate.capacity();
    }

    public int admitted() {
        return gate.inUse();
    }

    public long pairsStarted() {
        return pairSequence.get();
    }

    public long pairsRegistered() {
        return pairsRegistered.get();
    }

    public long launchFailures() {
        return launchFailures.get();
    }

    public Map<RetireReason, Long> retiredByReason() {
        Map<RetireReason, Long> out = new EnumMap<>(RetireReason.class);
        retired.forEach((reason, count) -> out.put(reason, count.get()));
        return out;
    }
}
