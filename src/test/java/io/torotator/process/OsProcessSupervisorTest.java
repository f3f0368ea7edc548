package io.torotator.process;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static io.torotator.TestSupport.waitFor;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OsProcessSupervisorTest {
    private final OsProcessSupervisor supervisor = new OsProcessSupervisor(Duration.ofMillis(150), Duration.ofSeconds(5));
    private final ServiceIdentity identity = new ServiceIdentity("sleeper", 30001);

    @Test
    void startReturnsRunningProcessAndTerminateReapsIt() throws Exception {
        SupervisedProcess process = supervisor.start(identity, List.of("sh", "-c", "sleep 30"), OutputClassifier.PLAIN);
        assertTrue(process.isAlive());
        assertTrue(process.pid() > 0);

        process.terminate();
        assertFalse(process.isAlive());
        process.exited().get(5, TimeUnit.SECONDS);

        // second terminate is a no-op
        process.terminate();
    }

    @Test
    void terminateAfterNaturalExitIsQuiet() throws Exception {
        SupervisedProcess process = supervisor.start(identity, List.of("sh", "-c", "sleep 0.4"), OutputClassifier.PLAIN);
        assertTrue(waitFor(() -> !process.isAlive(), Duration.ofSeconds(5)));

        process.terminate();
        process.exited().get(5, TimeUnit.SECONDS);
        assertFalse(process.isAlive());
    }

    @Test
    void exitInsideSettleWindowIsLaunchFailureWithOutput() {
        OsProcessSupervisor slowSettle = new OsProcessSupervisor(Duration.ofSeconds(2), Duration.ofSeconds(5));
        LaunchException e = assertThrows(LaunchException.class,
                () -> slowSettle.start(identity, List.of("sh", "-c", "echo boom; exit 3"), OutputClassifier.PLAIN));
        assertTrue(e.getMessage().contains("code 3"), e.getMessage());
        assertTrue(e.getMessage().contains("boom"), e.getMessage());
        assertTrue(e.getMessage().startsWith("sleeper:30001"), e.getMessage());
    }

    @Test
    void missingProgramIsLaunchFailure() {
        assertThrows(LaunchException.class,
                () -> supervisor.start(identity, List.of("/nonexistent/torotator-test-binary"), OutputClassifier.PLAIN));
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> supervisor.start(identity, List.of(), OutputClassifier.PLAIN));
    }

    @Test
    void drainCompletesExitedWhenProgramStops() throws Exception {
        SupervisedProcess process = supervisor.start(identity,
                List.of("sh", "-c", "sleep 0.5; echo '[WARNING] going away'; echo done"), line -> {
                    throw new IllegalStateException("classifier failures must not stop draining");
                });
        Thread drainer = new Thread(process::drain, "drain-test");
        drainer.start();

        process.exited().get(10, TimeUnit.SECONDS);
        drainer.join(5_000L);
        assertFalse(drainer.isAlive());
        assertFalse(process.isAlive());
    }
}
