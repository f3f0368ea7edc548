package io.torotator.process;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class OsSupervisedProcess implements SupervisedProcess {
    private static final Logger LOG = LogManager.getLogger(OsSupervisedProcess.class);
    private static final Logger OUTPUT = LogManager.getLogger("torotator.process");

    private final ServiceIdentity identity;
    private final Process process;
    private final OutputClassifier classifier;
    private final Duration terminateTimeout;
    private final CompletableFuture<Void> exited = new CompletableFuture<>();
    private volatile boolean killed;

    OsSupervisedProcess(ServiceIdentity identity, Process process, OutputClassifier classifier, Duration terminateTimeout) {
        this.identity = identity;
        this.process = process;
        this.classifier = classifier == null ? OutputClassifier.PLAIN : classifier;
        this.terminateTimeout = terminateTimeout;
    }

    @Override
    public ServiceIdentity identity() {
        return identity;
    }

    @Override
    public long pid() {
        return process == null ? -1L : process.pid();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public CompletableFuture<Void> exited() {
        return exited.copy();
    }

    @Override
    public void drain() {
        try (CloseableThreadContext.Instance ignored = logContext()) {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    ClassifiedLine classified = classifySafely(line);
                    OUTPUT.log(classified.level().log4jLevel(), "{}", classified.message());
                }
            } catch (IOException e) {
                if (!killed) {
                    LOG.error("Output error", e);
                }
            }

            try {
                int code = process.waitFor();
                if (killed) {
                    LOG.debug("Exited with code {} after kill", code);
                } else {
                    LOG.info("Exited with code {}", code);
                }
                exited.complete(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("Interrupted while waiting for exit");
            }
        }
    }

    @Override
    public synchronized void terminate() throws TerminationException {
        if (!process.isAlive()) {
            exited.complete(null);
            return;
        }
        try (CloseableThreadContext.Instance ignored = logContext()) {
            LOG.debug("Killing process");
            killed = true;
            process.destroyForcibly();
            boolean gone;
            try {
                gone = process.waitFor(terminateTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TerminationException(identity + ": interrupted while waiting for pid " + pid() + " to exit", e);
            }
            if (!gone) {
                throw new TerminationException(
                        identity + ": pid " + pid() + " still alive " + terminateTimeout.toMillis() + "ms after kill");
            }
            // the kill signal exit status is the expected outcome here
            exited.complete(null);
        }
    }

    private ClassifiedLine classifySafely(String line) {
        try {
            ClassifiedLine classified = classifier.classify(line);
            return classified == null ? ClassifiedLine.info(line) : classified;
        } catch (RuntimeException e) {
            LOG.debug("Unclassifiable output line: {}", line, e);
            return ClassifiedLine.info(line);
        }
    }

    private CloseableThreadContext.Instance logContext() {
        return CloseableThreadContext.putAll(identity.logContext()).put("pid", Long.toString(pid()));
    }

    @Override
    public String toString() {
        return identity + "[pid=" + pid() + "]";
    }
}
