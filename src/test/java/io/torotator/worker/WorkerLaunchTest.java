package io.torotator.worker;

import io.torotator.config.TorotatorConfig;
import io.torotator.process.FakeProcessSupervisor;
import io.torotator.process.LaunchException;
import io.torotator.util.FileTrees;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerLaunchTest {
    private Path root;
    private TorotatorConfig config;
    private FakeProcessSupervisor supervisor;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("torotator-worker-");
        config = new TorotatorConfig(root);
        supervisor = new FakeProcessSupervisor();
    }

    @AfterEach
    void tearDown() throws Exception {
        FileTrees.deleteRecursively(root);
    }

    @Test
    void circuitLaunchUsesSocksPortAndPrivateDataDir() throws Exception {
        TorCircuit circuits = new TorCircuit(supervisor, config, 120L);
        try (ManagedService circuit = circuits.launch(30_001)) {
            assertEquals(30_001, circuit.port());
            assertTrue(Files.isDirectory(config.torDir(30_001)));
            List<String> cmd = supervisor.commands("tor").get(0);
            assertEquals("30001", cmd.get(cmd.indexOf("--SocksPort") + 1));
            assertEquals("120", cmd.get(cmd.indexOf("--NewCircuitPeriod") + 1));
            assertEquals(config.torDir(30_001).toString(), cmd.get(cmd.indexOf("--DataDirectory") + 1));
        }
        assertFalse(Files.exists(config.torDir(30_001)));
        assertTrue(supervisor.started("tor").get(0).wasTerminated());
    }

    @Test
    void forwarderConfigPointsAtCircuit() throws Exception {
        PrivoxyForwarder forwarders = new PrivoxyForwarder(supervisor, config);
        try (ManagedService forwarder = forwarders.launch(30_002, 30_001)) {
            Path conf = forwarder.dir().resolve("privoxy.conf");
            String text = Files.readString(conf);
            assertTrue(text.contains("listen-address  127.0.0.1:30002"), text);
            assertTrue(text.contains("forward-socks5t / 127.0.0.1:30001 ."), text);
            assertTrue(text.contains("logdir " + forwarder.dir()), text);
            List<String> cmd = supervisor.commands("privoxy").get(0);
            assertEquals(List.of("privoxy", "--no-daemon"), cmd.subList(0, 2));
            assertEquals(conf.toString(), cmd.get(cmd.size() - 1));
        }
        assertFalse(Files.exists(config.privoxyDir(30_002)));
    }

    @Test
    void failedLaunchLeavesNoDirectoryBehind() {
        supervisor.failNext("privoxy", 1);
        PrivoxyForwarder forwarders = new PrivoxyForwarder(supervisor, config);
        LaunchException e = assertThrows(LaunchException.class, () -> forwarders.launch(30_004, 30_003));
        assertEquals("privoxy", e.identity().service());
        assertFalse(Files.exists(config.privoxyDir(30_004)));
    }
}
