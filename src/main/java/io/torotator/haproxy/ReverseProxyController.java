package io.torotator.haproxy;

import io.torotator.config.TorotatorConfig;
import io.torotator.process.LaunchException;
import io.torotator.process.ProcessSupervisor;
import io.torotator.process.ServiceIdentity;
import io.torotator.process.SupervisedProcess;
import io.torotator.process.TerminationException;
import io.torotator.util.FileTrees;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the HAProxy process and keeps its configuration in line with the {@link BackendRegistry}.
 *
 * <p>Reload requests move the controller from {@link ReloadState#IDLE} to {@link ReloadState#PENDING}
 * and arm a quiet-period timer; every further request re-arms it, bounded by a ceiling measured from
 * the first request of the batch. When the timer fires the controller enters
 * {@link ReloadState#RELOADING}: it renders the config from the registry as it is at that moment,
 * starts a replacement HAProxy with {@code -sf <old pid>} and then terminates the old instance.
 * Requests that arrive while reloading collapse into one follow-up batch.
 *
 * <p>A failed render or a replacement that does not start leaves the old instance serving traffic.
 */
public final class ReverseProxyController implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ReverseProxyController.class);
    public static final String EXECUTABLE = "haproxy";

    private final ProcessSupervisor supervisor;
    private final BackendRegistry registry;
    private final TorotatorConfig config;
    private final HaproxyDescriptor baseDescriptor;
    private final Duration quietPeriod;
    private final Duration ceiling;
    private final Executor drainExecutor;
    private final ServiceIdentity identity;
    private final ScheduledExecutorService reloadExecutor;
    private final HaproxyLogClassifier classifier = new HaproxyLogClassifier();

    private final Object stateLock = new Object();
    private final Object configLock = new Object();
    private ReloadState state = ReloadState.IDLE;
    private ScheduledFuture<?> timer;
    private long timerGeneration;
    private long batchStartNanos;
    private boolean followUpRequested;
    private boolean closed;

    private volatile SupervisedProcess current;
    private volatile List<Integer> lastRenderedBackends = List.of();
    private final AtomicLong reloadRequests = new AtomicLong(0L);
    private final AtomicLong reloadsCompleted = new AtomicLong(0L);
    private final AtomicLong reloadsFailed = new AtomicLong(0L);

    public ReverseProxyController(
            ProcessSupervisor supervisor,
            BackendRegistry registry,
            TorotatorConfig config,
            HaproxyDescriptor baseDescriptor,
            Duration quietPeriod,
            Duration ceiling,
            Executor drainExecutor
    ) {
        this.supervisor = supervisor;
        this.registry = registry;
        this.config = config;
        this.baseDescriptor = baseDescriptor;
        this.quietPeriod = quietPeriod;
        this.ceiling = ceiling.compareTo(quietPeriod) < 0 ? quietPeriod : ceiling;
        this.drainExecutor = drainExecutor;
        this.identity = new ServiceIdentity("haproxy", baseDescriptor.port());
        this.reloadExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "haproxy-reload");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Writes the initial config synchronously and starts the first HAProxy instance. Failures here
     * leave nothing running and are fatal to the caller.
     */
    public void start() throws RenderException, IOException, LaunchException {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(identity.logContext())) {
            Files.createDirectories(config.haproxyDir());
            List<Integer> backends = writeConfig();
            SupervisedProcess first = supervisor.start(identity, command(-1L), classifier);
            current = first;
            lastRenderedBackends = backends;
            watch(first);
            registry.onChange(this::requestReload);
            LOG.info("HAProxy started with {} backend(s)", backends.size());
        }
    }

    /**
     * Debounced reload; returns immediately.
     */
    public void requestReload() {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            reloadRequests.incrementAndGet();
            switch (state) {
                case IDLE -> {
                    state = ReloadState.PENDING;
                    batchStartNanos = System.nanoTime();
                    armTimer(quietPeriod.toMillis());
                    LOG.debug("Reload queued");
                }
                case PENDING -> {
                    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - batchStartNanos);
                    long remainingCeilingMs = Math.max(0L, ceiling.toMillis() - elapsedMs);
                    armTimer(Math.min(quietPeriod.toMillis(), remainingCeilingMs));
                    LOG.debug("Reload already queued, delay re-armed");
                }
                case RELOADING -> {
                    if (followUpRequested) {
                        LOG.debug("Follow-up reload already queued");
                    } else {
                        followUpRequested = true;
                        LOG.debug("Follow-up reload queued");
                    }
                }
            }
        }
    }

    /**
     * Reload without waiting for a quiet period, still serialized with debounced reloads.
     */
    public void reloadNow() {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            reloadRequests.incrementAndGet();
            if (state == ReloadState.RELOADING) {
                followUpRequested = true;
                return;
            }
            state = ReloadState.PENDING;
            batchStartNanos = System.nanoTime();
            armTimer(0L);
        }
    }

    private void armTimer(long delayMs) {
        if (timer != null) {
            timer.cancel(false);
        }
        long generation = ++timerGeneration;
        timer = reloadExecutor.schedule(() -> fire(generation), delayMs, TimeUnit.MILLISECONDS);
    }

    private void fire(long generation) {
        synchronized (stateLock) {
            if (closed || state != ReloadState.PENDING || generation != timerGeneration) {
                return;
            }
            state = ReloadState.RELOADING;
            timer = null;
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(identity.logContext())) {
            executeReload();
        } finally {
            synchronized (stateLock) {
                if (followUpRequested && !closed) {
                    followUpRequested = false;
                    state = ReloadState.PENDING;
                    batchStartNanos = System.nanoTime();
                    armTimer(quietPeriod.toMillis());
                } else {
                    state = ReloadState.IDLE;
                }
            }
        }
    }

    private void executeReload() {
        SupervisedProcess previous = current;
        long previousPid = previous == null ? -1L : previous.pid();
        List<Integer> backends;
        try {
            backends = writeConfig();
        } catch (RenderException | IOException e) {
            reloadsFailed.incrementAndGet();
            LOG.error("Failed to render config, keeping pid {}", previousPid, e);
            return;
        }

        SupervisedProcess replacement;
        try {
            replacement = supervisor.start(identity, command(previousPid), classifier);
        } catch (LaunchException e) {
            reloadsFailed.incrementAndGet();
            LOG.error("Failed to start new instance, keeping pid {}", previousPid, e);
            return;
        }
        current = replacement;
        lastRenderedBackends = backends;
        watch(replacement);

        if (previous != null) {
            try {
                previous.terminate();
            } catch (TerminationException e) {
                LOG.warn("Failed to clean up previous instance", e);
            }
        }
        reloadsCompleted.incrementAndGet();
        LOG.info("Reloaded: pid {} -> {}, backends={}", previousPid, replacement.pid(), backends);
    }

    private List<Integer> writeConfig() throws RenderException, IOException {
        synchronized (configLock) {
            List<Integer> backends = registry.snapshot();
            String rendered = HaproxyConfigRenderer.render(baseDescriptor.withBackends(backends));
            FileTrees.writeAtomically(config.haproxyConfigFile(), rendered);
            return backends;
        }
    }

    private List<String> command(long previousPid) {
        List<String> cmd = new ArrayList<>(List.of(EXECUTABLE, "-f", config.haproxyConfigFile().toString()));
        if (previousPid > 0) {
            cmd.add("-sf");
            cmd.add(Long.toString(previousPid));
        }
        return cmd;
    }

    private void watch(SupervisedProcess process) {
        drainExecutor.execute(process::drain);
        process.exited().thenRun(() -> {
            if (current == process && !isClosed()) {
                try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(identity.logContext())) {
                    LOG.error("HAProxy pid {} exited while still serving; next reload starts a fresh instance", process.pid());
                }
            }
        });
    }

    public ReloadState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    private boolean isClosed() {
        synchronized (stateLock) {
            return closed;
        }
    }

    public long pid() {
        SupervisedProcess p = current;
        return p == null ? -1L : p.pid();
    }

    public Path configFile() {
        return config.haproxyConfigFile();
    }

    public List<Integer> lastRenderedBackends() {
        return lastRenderedBackends;
    }

    public long reloadRequests() {
        return reloadRequests.get();
    }

    public long reloadsCompleted() {
        return reloadsCompleted.get();
    }

    public long reloadsFailed() {
        return reloadsFailed.get();
    }

    @Override
    public void close() {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
        }
        reloadExecutor.shutdown();
        try {
            if (!reloadExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Reload executor did not stop in time");
                reloadExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            reloadExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(identity.logContext())) {
            SupervisedProcess p = current;
            if (p != null) {
                LOG.info("Cleaning up");
                try {
                    p.terminate();
                } catch (TerminationException e) {
                    LOG.error("Failed to kill server", e);
                }
            }
            try {
                FileTrees.deleteRecursively(config.haproxyDir());
            } catch (IOException e) {
                LOG.error("Failed to remove directory {}", config.haproxyDir(), e);
            }
        }
    }
}
