package io.torotator.worker;

import io.torotator.config.TorotatorConfig;
import io.torotator.process.LaunchException;
import io.torotator.process.ProcessSupervisor;
import io.torotator.process.ServiceIdentity;
import io.torotator.process.SupervisedProcess;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

/**
 * Launches Tor circuit processes. Tor refuses a data directory readable by others, hence 0700.
 */
public final class TorCircuit {
    public static final String EXECUTABLE = "tor";

    private final ProcessSupervisor supervisor;
    private final TorotatorConfig config;
    private final long circuitTimeSec;
    private final TorLogClassifier classifier = new TorLogClassifier();

    public TorCircuit(ProcessSupervisor supervisor, TorotatorConfig config, long circuitTimeSec) {
        this.supervisor = supervisor;
        this.config = config;
        this.circuitTimeSec = circuitTimeSec;
    }

    public ManagedService launch(int socksPort) throws LaunchException {
        ServiceIdentity identity = new ServiceIdentity("tor", socksPort);
        Path dir = config.torDir(socksPort);
        try {
            createPrivateDir(dir);
        } catch (IOException e) {
            throw new LaunchException(identity, "cannot create data directory " + dir, e);
        }
        try {
            SupervisedProcess process = supervisor.start(identity, command(socksPort, dir), classifier);
            return new ManagedService(process, dir);
        } catch (LaunchException e) {
            ManagedService.removeDir(dir);
            throw e;
        }
    }

    List<String> command(int socksPort, Path dir) {
        return List.of(
                EXECUTABLE,
                "--allow-missing-torrc",
                "--SocksPort", Integer.toString(socksPort),
                "--NewCircuitPeriod", Long.toString(circuitTimeSec),
                "--DataDirectory", dir.toString(),
                "--PidFile", dir.resolve("tor.pid").toString(),
                "--Log", "warn stdout"
        );
    }

    private static void createPrivateDir(Path dir) throws IOException {
        Files.createDirectories(dir);
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(dir, PosixFilePermissions.fromString("rwx------"));
        }
    }
}
