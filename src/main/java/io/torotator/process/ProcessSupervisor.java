package io.torotator.process;

import java.util.List;

public interface ProcessSupervisor {
    /**
     * Spawns {@code command} with stdout and stderr merged. Returns only after the process has
     * survived the settle window.
     *
     * @throws LaunchException if the process cannot be spawned or exits during the settle window
     */
    SupervisedProcess start(ServiceIdentity identity, List<String> command, OutputClassifier classifier)
            throws LaunchException;
}
