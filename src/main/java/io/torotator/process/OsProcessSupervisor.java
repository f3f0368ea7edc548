package io.torotator.process;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Starts real OS processes through {@link ProcessBuilder}.
 */
public final class OsProcessSupervisor implements ProcessSupervisor {
    private static final Logger LOG = LogManager.getLogger(OsProcessSupervisor.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final Duration settleWindow;
    private final Duration terminateTimeout;

    public OsProcessSupervisor(Duration settleWindow, Duration terminateTimeout) {
        this.settleWindow = settleWindow;
        this.terminateTimeout = terminateTimeout;
    }

    @Override
    public SupervisedProcess start(ServiceIdentity identity, List<String> command, OutputClassifier classifier)
            throws LaunchException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty: " + identity);
        }
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(identity.logContext())) {
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                LOG.error("Failed to start {}", command.get(0), e);
                throw new LaunchException(identity, "spawn failed: " + e.getMessage(), e);
            }

            try {
                if (process.waitFor(settleWindow.toMillis(), TimeUnit.MILLISECONDS)) {
                    String output = readRemaining(process);
                    throw new LaunchException(identity,
                            "exited with code " + process.exitValue() + " within " + settleWindow.toMillis()
                                    + "ms, output=" + output);
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new LaunchException(identity, "interrupted during settle window", e);
            }

            LOG.info("Running with pid {}", process.pid());
            return new OsSupervisedProcess(identity, process, classifier, terminateTimeout);
        }
    }

    private static String readRemaining(Process process) {
        try {
            String raw = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
            if (normalized.length() <= MAX_ERROR_CHARS) {
                return normalized;
            }
            return normalized.substring(normalized.length() - MAX_ERROR_CHARS);
        } catch (IOException e) {
            return "<unreadable: " + e.getMessage() + ">";
        }
    }
}
