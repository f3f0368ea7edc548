package io.torotator.pool;

import io.torotator.config.PoolSettings;
import io.torotator.config.TorotatorConfig;
import io.torotator.haproxy.BackendRegistry;
import io.torotator.haproxy.HaproxyDescriptor;
import io.torotator.haproxy.RenderException;
import io.torotator.haproxy.ReverseProxyController;
import io.torotator.observability.PoolStatus;
import io.torotator.observability.StatusServer;
import io.torotator.port.PortAllocator;
import io.torotator.process.LaunchException;
import io.torotator.process.ProcessSupervisor;
import io.torotator.worker.PrivoxyForwarder;
import io.torotator.worker.TorCircuit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires allocator, registry, HAProxy controller and rotation scheduler for one run of the pool.
 */
public final class ProxyPool implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ProxyPool.class);

    private final PoolSettings settings;
    private final TorotatorConfig config;
    private final ShutdownSignal shutdown;
    private final ExecutorService drainExecutor;
    private final PortAllocator ports;
    private final BackendRegistry registry;
    private final ReverseProxyController controller;
    private final RotationScheduler scheduler;
    private StatusServer statusServer;

    public ProxyPool(PoolSettings settings, ProcessSupervisor supervisor, ShutdownSignal shutdown) {
        this.settings = settings;
        this.config = settings.toConfig();
        this.shutdown = shutdown;
        AtomicInteger threadSeq = new AtomicInteger(0);
        this.drainExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "process-output-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.ports = new PortAllocator(settings.portRangeStart(), settings.portRangeEnd());
        this.registry = new BackendRegistry();
        this.controller = new ReverseProxyController(
                supervisor,
                registry,
                config,
                new HaproxyDescriptor(settings.proxyPort(), settings.statsPort(), settings.maxConn(), settings.balance(), List.of()),
                Duration.ofMillis(settings.reloadQuietMs()),
                Duration.ofMillis(settings.reloadCeilingMs()),
                drainExecutor
        );
        this.scheduler = new RotationScheduler(
                settings.poolSize(),
                Duration.ofSeconds(settings.maxProxyTimeSec()),
                Duration.ofMillis(settings.launchBackoffMs()),
                ports,
                registry,
                new TorCircuit(supervisor, config, settings.circuitTimeSec()),
                new PrivoxyForwarder(supervisor, config),
                shutdown,
                drainExecutor
        );
    }

    /**
     * Starts HAProxy and the optional status endpoint. Any failure here means the pool cannot serve.
     */
    public void start() throws IOException, RenderException, LaunchException {
        Files.createDirectories(config.workDir());
        controller.start();
        if (settings.statusPort() > 0) {
            statusServer = StatusServer.start(settings.statusPort(), this::status);
        }
    }

    /**
     * Rotates pairs until shutdown is triggered and all live pairs have retired.
     */
    public void run() {
        scheduler.run();
    }

    public void reloadNow() {
        LOG.info("Reloading HAProxy on request");
        controller.reloadNow();
    }

    public void shutdown() {
        shutdown.trigger();
    }

    public PoolStatus status() {
        return PoolStatus.capture(scheduler, controller, registry, ports);
    }

    public BackendRegistry registry() {
        return registry;
    }

    public ReverseProxyController controller() {
        return controller;
    }

    public RotationScheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        if (statusServer != null) {
            statusServer.close();
        }
        controller.close();
        drainExecutor.shutdownNow();
        // per-process directories are removed by their owners; the root only if nothing else is in it
        try {
            Files.deleteIfExists(config.workDir());
        } catch (DirectoryNotEmptyException e) {
            LOG.warn("Work directory {} not empty, leaving it in place", config.workDir());
        } catch (IOException e) {
            LOG.error("Failed to remove work directory {}", config.workDir(), e);
        }
    }
}
