package io.torotator.pool;

import io.torotator.config.PoolSettings;
import io.torotator.observability.PoolStatus;
import io.torotator.process.FakeProcessSupervisor;
import io.torotator.util.FileTrees;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static io.torotator.TestSupport.waitFor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProxyPoolTest {
    @Test
    void poolServesRegisteredForwardersAndCleansUp() throws Exception {
        Path root = Files.createTempDirectory("torotator-proxypool-");
        Path workDir = root.resolve("work");
        FakeProcessSupervisor supervisor = new FakeProcessSupervisor();
        ShutdownSignal shutdown = new ShutdownSignal();
        PoolSettings settings = PoolSettings.defaults().apply(new PoolSettings.Overrides(
                9090, 2, 31_000, 31_099, null, null, null, null, null, null, 100L, 500L, null, 50L, workDir.toString()));
        try {
            ProxyPool pool = new ProxyPool(settings, supervisor, shutdown);
            pool.start();
            Thread runner = new Thread(pool::run, "proxypool-test");
            runner.start();

            assertTrue(waitFor(() -> pool.controller().lastRenderedBackends().size() == 2, Duration.ofSeconds(5)));
            String cfg = Files.readString(pool.controller().configFile());
            assertTrue(cfg.contains("bind *:9090"), cfg);
            for (int backend : pool.registry().snapshot()) {
                assertTrue(cfg.contains("server privoxy-" + backend + " 127.0.0.1:" + backend + " check"), cfg);
            }

            PoolStatus status = pool.status();
            assertEquals(2, status.capacity());
            assertEquals(2, status.backends().size());
            assertEquals(4, status.portsLeased());
            assertEquals(pool.controller().pid(), status.haproxyPid());
            assertEquals(2, status.pairs().size());

            pool.shutdown();
            runner.join(10_000L);
            assertFalse(runner.isAlive());
            pool.close();

            assertTrue(supervisor.started().stream().noneMatch(p -> p.isAlive()));
            assertFalse(Files.exists(workDir));
        } finally {
            FileTrees.deleteRecursively(root);
        }
    }

    @Test
    void circuitExitDropsItsForwarderFromTheReloadedConfig() throws Exception {
        Path root = Files.createTempDirectory("torotator-proxypool-");
        Path workDir = root.resolve("work");
        FakeProcessSupervisor supervisor = new FakeProcessSupervisor();
        ShutdownSignal shutdown = new ShutdownSignal();
        PoolSettings settings = PoolSettings.defaults().apply(new PoolSettings.Overrides(
                9090, 1, 31_000, 31_099, null, null, null, null, null, null, 100L, 500L, null, 50L, workDir.toString()));
        try {
            ProxyPool pool = new ProxyPool(settings, supervisor, shutdown);
            pool.start();
            Thread runner = new Thread(pool::run, "proxypool-test");
            runner.start();

            assertTrue(waitFor(() -> pool.controller().lastRenderedBackends().size() == 1, Duration.ofSeconds(5)));
            int dead = pool.controller().lastRenderedBackends().get(0);

            supervisor.started("tor").get(0).exit();

            assertTrue(waitFor(() -> {
                List<Integer> backends = pool.controller().lastRenderedBackends();
                return backends.size() == 1 && !backends.contains(dead);
            }, Duration.ofSeconds(5)));
            String cfg = Files.readString(pool.controller().configFile());
            assertFalse(cfg.contains("privoxy-" + dead), cfg);
            int replacement = pool.controller().lastRenderedBackends().get(0);
            assertTrue(cfg.contains("server privoxy-" + replacement + " 127.0.0.1:" + replacement + " check"), cfg);

            pool.shutdown();
            runner.join(10_000L);
            pool.close();
        } finally {
            FileTrees.deleteRecursively(root);
        }
    }
}
