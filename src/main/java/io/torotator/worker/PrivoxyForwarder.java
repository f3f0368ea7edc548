package io.torotator.worker;

import freemarker.template.TemplateException;
import io.torotator.config.TorotatorConfig;
import io.torotator.process.LaunchException;
import io.torotator.process.ProcessSupervisor;
import io.torotator.process.ServiceIdentity;
import io.torotator.process.SupervisedProcess;
import io.torotator.util.FileTrees;
import io.torotator.util.ConfigTemplates;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Launches Privoxy instances that forward plain HTTP proxy traffic to a Tor SOCKS port.
 */
public final class PrivoxyForwarder {
    public static final String EXECUTABLE = "privoxy";
    static final String CONFIG_TEMPLATE = "privoxy.conf.ftl";

    private final ProcessSupervisor supervisor;
    private final TorotatorConfig config;
    private final PrivoxyLogClassifier classifier = new PrivoxyLogClassifier();

    public PrivoxyForwarder(ProcessSupervisor supervisor, TorotatorConfig config) {
        this.supervisor = supervisor;
        this.config = config;
    }

    public ManagedService launch(int port, int circuitPort) throws LaunchException {
        ServiceIdentity identity = new ServiceIdentity("privoxy", port);
        Path dir = config.privoxyDir(port);
        Path conf = dir.resolve("privoxy.conf");
        try {
            Files.createDirectories(dir);
            FileTrees.writeAtomically(conf, renderConfig(dir, port, circuitPort));
        } catch (IOException | TemplateException e) {
            ManagedService.removeDir(dir);
            throw new LaunchException(identity, "cannot write config " + conf, e);
        }
        try {
            SupervisedProcess process = supervisor.start(identity, List.of(
                    EXECUTABLE,
                    "--no-daemon",
                    "--pidfile", dir.resolve("privoxy.pid").toString(),
                    conf.toString()
            ), classifier);
            return new ManagedService(process, dir);
        } catch (LaunchException e) {
            ManagedService.removeDir(dir);
            throw e;
        }
    }

    static String renderConfig(Path logDir, int port, int circuitPort) throws IOException, TemplateException {
        return ConfigTemplates.render(CONFIG_TEMPLATE, Map.of(
                "logDir", logDir.toString(),
                "port", port,
                "circuitPort", circuitPort
        ));
    }
}
