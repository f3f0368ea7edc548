package io.torotator.cli;

import io.torotator.config.PoolSettings;
import io.torotator.config.TorotatorConfig;
import io.torotator.haproxy.HaproxyConfigRenderer;
import io.torotator.haproxy.HaproxyDescriptor;
import io.torotator.haproxy.RenderException;
import io.torotator.pool.ProxyPool;
import io.torotator.pool.ShutdownSignal;
import io.torotator.process.OsProcessSupervisor;
import io.torotator.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import sun.misc.Signal;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "torotator",
        mixinStandardHelpOptions = true,
        version = "torotator " + TorotatorConfig.VERSION,
        description = "Rotating pool of Tor circuits behind Privoxy and HAProxy",
        subcommands = {
                TorotatorCommand.RunCommand.class,
                TorotatorCommand.RenderConfigCommand.class,
                TorotatorCommand.CheckDepsCommand.class
        }
)
public final class TorotatorCommand implements Runnable {
    private static final Logger LOG = LogManager.getLogger(TorotatorCommand.class);

    @Override
    public void run() {
        System.out.println("Use subcommands: run | render-config | check-deps");
    }

    @Command(name = "run", description = "Start HAProxy and keep the Tor/Privoxy pool rotating until interrupted")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TorotatorCommand parent;

        @Option(names = {"-p", "--port"}, description = "Port HAProxy listens on (default: 8080)")
        Integer port;

        @Option(names = {"-c", "--count"}, description = "Number of Tor/Privoxy pairs (default: 3)")
        Integer count;

        @Option(names = {"-s", "--port-range-start"}, description = "Lowest port leased to workers (default: 30000)")
        Integer portRangeStart;

        @Option(names = {"--port-range-end"}, description = "Highest port leased to workers (default: 65535)")
        Integer portRangeEnd;

        @Option(names = {"-m", "--max-proxy-time"}, description = "Seconds a pair lives before rotation (default: 900)")
        Long maxProxyTime;

        @Option(names = {"-t", "--circuit-time"}, description = "Tor NewCircuitPeriod in seconds (default: 120)")
        Long circuitTime;

        @Option(names = {"--stats"}, description = "HAProxy stats page port; 0 disables it (default: 0)")
        Integer stats;

        @Option(names = {"--max-conn"}, description = "HAProxy maxconn (default: 256)")
        Integer maxConn;

        @Option(names = {"--balance"}, description = "HAProxy balance policy: roundrobin|leastconn (default: roundrobin)")
        String balance;

        @Option(names = {"--work-dir"}, description = "Directory for generated configs and data (default: /tmp/torotator)")
        String workDir;

        @Option(names = {"--status-port"}, description = "Port for /status and /metrics; 0 disables it (default: 0)")
        Integer statusPort;

        @Option(names = {"--settings"}, description = "Optional JSON settings file, overridden by explicit options")
        Path settingsFile;

        @Override
        public Integer call() {
            PoolSettings settings;
            try {
                settings = PoolSettings.defaults()
                        .apply(PoolSettings.readFile(settingsFile))
                        .apply(overrides());
            } catch (IllegalArgumentException | UncheckedIOException e) {
                LOG.fatal("Invalid settings: {}", e.getMessage());
                return 1;
            }

            Map<String, Optional<Path>> deps = DependencyCheck.resolve(DependencyCheck.REQUIRED, System.getenv("PATH"));
            List<String> missing = new ArrayList<>();
            deps.forEach((name, path) -> {
                if (path.isEmpty()) {
                    missing.add(name);
                }
            });
            if (!missing.isEmpty()) {
                LOG.fatal("Required programs not found on PATH: {}", missing);
                return 1;
            }

            ShutdownSignal shutdown = new ShutdownSignal();
            OsProcessSupervisor supervisor = new OsProcessSupervisor(
                    Duration.ofMillis(settings.settleMs()),
                    Duration.ofMillis(TorotatorConfig.DEFAULT_TERMINATE_TIMEOUT_MS)
            );
            ProxyPool pool = new ProxyPool(settings, supervisor, shutdown);
            try {
                pool.start();
            } catch (Exception e) {
                LOG.fatal("Failed to start HAProxy", e);
                pool.close();
                return 1;
            }

            CountDownLatch finished = new CountDownLatch(1);
            installSignalHandlers(pool);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                pool.shutdown();
                try {
                    if (!finished.await(TorotatorConfig.DEFAULT_TERMINATE_TIMEOUT_MS * 2, TimeUnit.MILLISECONDS)) {
                        LOG.warn("Pool did not finish cleanup before exit");
                    }
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "torotator-shutdown-hook"));

            LOG.info("Listening on port {} with {} pair(s)", settings.proxyPort(), settings.poolSize());
            try {
                pool.run();
            } finally {
                pool.close();
                finished.countDown();
            }
            LOG.info("Shut down");
            return 0;
        }

        PoolSettings.Overrides overrides() {
            return new PoolSettings.Overrides(
                    port,
                    count,
                    portRangeStart,
                    portRangeEnd,
                    maxProxyTime,
                    circuitTime,
                    stats,
                    statusPort,
                    maxConn,
                    balance,
                    null,
                    null,
                    null,
                    null,
                    workDir
            );
        }

        private static void installSignalHandlers(ProxyPool pool) {
            handle("HUP", signal -> pool.reloadNow());
            handle("INT", signal -> {
                LOG.info("Received SIG{}, shutting down", signal.getName());
                pool.shutdown();
            });
            handle("TERM", signal -> {
                LOG.info("Received SIG{}, shutting down", signal.getName());
                pool.shutdown();
            });
        }

        private static void handle(String name, sun.misc.SignalHandler handler) {
            try {
                Signal.handle(new Signal(name), handler);
            } catch (IllegalArgumentException e) {
                LOG.warn("Cannot handle SIG{} on this platform", name);
            }
        }
    }

    @Command(name = "render-config", description = "Print the HAProxy config for the given backend ports")
    static final class RenderConfigCommand implements Callable<Integer> {
        @ParentCommand
        TorotatorCommand parent;

        @Option(names = {"-p", "--port"}, defaultValue = "8080", description = "Frontend port")
        int port;

        @Option(names = {"--stats"}, defaultValue = "0", description = "Stats page port; 0 disables it")
        int stats;

        @Option(names = {"--max-conn"}, defaultValue = "256", description = "HAProxy maxconn")
        int maxConn;

        @Option(names = {"--balance"}, defaultValue = "roundrobin", description = "Balance policy: roundrobin|leastconn")
        String balance;

        @Parameters(description = "Privoxy backend ports")
        List<Integer> backends = new ArrayList<>();

        @Override
        public Integer call() {
            String rendered;
            try {
                rendered = HaproxyConfigRenderer.render(new HaproxyDescriptor(port, stats, maxConn, balance, backends));
            } catch (RenderException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 1;
            }
            System.out.print(rendered);
            return 0;
        }
    }

    @Command(name = "check-deps", description = "Report which of haproxy, privoxy and tor are on PATH")
    static final class CheckDepsCommand implements Callable<Integer> {
        @ParentCommand
        TorotatorCommand parent;

        @Override
        public Integer call() {
            Map<String, Optional<Path>> deps = DependencyCheck.resolve(DependencyCheck.REQUIRED, System.getenv("PATH"));
            Map<String, String> out = new LinkedHashMap<>();
            boolean complete = true;
            for (Map.Entry<String, Optional<Path>> e : deps.entrySet()) {
                out.put(e.getKey(), e.getValue().map(Path::toString).orElse(null));
                complete &= e.getValue().isPresent();
            }
            System.out.println(Jsons.toJson(out));
            return complete ? 0 : 1;
        }
    }
}
