package io.torotator.process;

import java.util.concurrent.CompletableFuture;

/**
 * One running external program.
 */
public interface SupervisedProcess {
    ServiceIdentity identity();

    /**
     * OS process id, or {@code -1} when no process is attached.
     */
    long pid();

    boolean isAlive();

    /**
     * Completes once, when the process has exited. Any number of callers may observe it, also after
     * it completed.
     */
    CompletableFuture<Void> exited();

    /**
     * Consumes the merged output until EOF, logging each classified line, then waits for the process
     * to exit and completes {@link #exited()}. Blocks; run it on a dedicated task.
     */
    void drain();

    /**
     * Kills and reaps the process. Does nothing when it already exited.
     *
     * @throws TerminationException if the process is still alive after the kill
     */
    void terminate() throws TerminationException;
}
