package io.torotator.worker;

import io.torotator.process.SupervisedProcess;
import io.torotator.process.TerminationException;
import io.torotator.util.FileTrees;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A supervised process together with the working directory it owns.
 */
public final class ManagedService implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ManagedService.class);

    private final SupervisedProcess process;
    private final Path dir;

    ManagedService(SupervisedProcess process, Path dir) {
        this.process = process;
        this.dir = dir;
    }

    public SupervisedProcess process() {
        return process;
    }

    public int port() {
        return process.identity().port();
    }

    public Path dir() {
        return dir;
    }

    /**
     * Kills the process and removes the working directory. Failures are logged; the directory is
     * removed even when the kill fails.
     */
    @Override
    public void close() {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(process.identity().logContext())
                .put("pid", Long.toString(process.pid()))) {
            LOG.info("Cleaning up");
            try {
                process.terminate();
            } catch (TerminationException e) {
                LOG.warn("Failed to kill server", e);
            } finally {
                removeDir(dir);
            }
        }
    }

    static void removeDir(Path dir) {
        try {
            FileTrees.deleteRecursively(dir);
        } catch (IOException e) {
            LOG.error("Failed to remove data directory {}", dir, e);
        }
    }
}
