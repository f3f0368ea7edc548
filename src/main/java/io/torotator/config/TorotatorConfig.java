package io.torotator.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TorotatorConfig {
    public static final String VERSION = "0.2.0";
    public static final String DEFAULT_WORK_DIR = "/tmp/torotator";
    public static final int DEFAULT_PROXY_PORT = 8080;
    public static final int DEFAULT_POOL_SIZE = 3;
    public static final int DEFAULT_PORT_RANGE_START = 30_000;
    public static final int DEFAULT_PORT_RANGE_END = 65_535;
    public static final long DEFAULT_MAX_PROXY_TIME_SEC = 900L;
    public static final long DEFAULT_CIRCUIT_TIME_SEC = 120L;
    public static final int DEFAULT_MAX_CONN = 256;
    public static final String DEFAULT_BALANCE = "roundrobin";
    public static final long DEFAULT_RELOAD_QUIET_MS = 2_000L;
    public static final long DEFAULT_RELOAD_CEILING_MS = 10_000L;
    public static final long DEFAULT_SETTLE_MS = 250L;
    public static final long DEFAULT_LAUNCH_BACKOFF_MS = 500L;
    public static final long DEFAULT_TERMINATE_TIMEOUT_MS = 5_000L;

    private final Path workDir;

    public TorotatorConfig(Path workDir) {
        this.workDir = workDir;
    }

    public static TorotatorConfig fromWorkDir(String dir) {
        Path resolved = dir == null || dir.isBlank()
                ? Paths.get(DEFAULT_WORK_DIR)
                : Paths.get(dir);
        return new TorotatorConfig(resolved.toAbsolutePath().normalize());
    }

    public Path workDir() {
        return workDir;
    }

    public Path haproxyDir() {
        return workDir.resolve("haproxy");
    }

    public Path haproxyConfigFile() {
        return haproxyDir().resolve("haproxy.cfg");
    }

    public Path torDir(int port) {
        return workDir.resolve("tor-" + port);
    }

    public Path privoxyDir(int port) {
        return workDir.resolve("privoxy-" + port);
    }
}
