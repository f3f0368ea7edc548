package io.torotator.config;

import io.torotator.haproxy.HaproxyDescriptor;
import io.torotator.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Effective orchestrator settings. Values come from {@link #defaults()}, optionally overlaid by a JSON
 * settings file and then by explicitly given command line options.
 */
public record PoolSettings(
        int proxyPort,
        int poolSize,
        int portRangeStart,
        int portRangeEnd,
        long maxProxyTimeSec,
        long circuitTimeSec,
        int statsPort,
        int statusPort,
        int maxConn,
        String balance,
        long reloadQuietMs,
        long reloadCeilingMs,
        long settleMs,
        long launchBackoffMs,
        String workDir
) {
    public static PoolSettings defaults() {
        return new PoolSettings(
                TorotatorConfig.DEFAULT_PROXY_PORT,
                TorotatorConfig.DEFAULT_POOL_SIZE,
                TorotatorConfig.DEFAULT_PORT_RANGE_START,
                TorotatorConfig.DEFAULT_PORT_RANGE_END,
                TorotatorConfig.DEFAULT_MAX_PROXY_TIME_SEC,
                TorotatorConfig.DEFAULT_CIRCUIT_TIME_SEC,
                0,
                0,
                TorotatorConfig.DEFAULT_MAX_CONN,
                TorotatorConfig.DEFAULT_BALANCE,
                TorotatorConfig.DEFAULT_RELOAD_QUIET_MS,
                TorotatorConfig.DEFAULT_RELOAD_CEILING_MS,
                TorotatorConfig.DEFAULT_SETTLE_MS,
                TorotatorConfig.DEFAULT_LAUNCH_BACKOFF_MS,
                TorotatorConfig.DEFAULT_WORK_DIR
        );
    }

    public static Overrides readFile(Path file) {
        if (file == null) {
            return Overrides.none();
        }
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Settings file not found: " + file);
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), Overrides.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings file: " + file, e);
        }
    }

    public PoolSettings apply(Overrides o) {
        if (o == null) {
            return this;
        }
        PoolSettings merged = new PoolSettings(
                sanitizeInt(o.proxyPort(), proxyPort, 1),
                sanitizeInt(o.poolSize(), poolSize, 1),
                sanitizeInt(o.portRangeStart(), portRangeStart, 1),
                sanitizeInt(o.portRangeEnd(), portRangeEnd, 1),
                sanitizeLong(o.maxProxyTimeSec(), maxProxyTimeSec, 1L),
                sanitizeLong(o.circuitTimeSec(), circuitTimeSec, 10L),
                sanitizeInt(o.statsPort(), statsPort, 0),
                sanitizeInt(o.statusPort(), statusPort, 0),
                sanitizeInt(o.maxConn(), maxConn, 1),
                o.balance() == null || o.balance().isBlank() ? balance : o.balance().trim().toLowerCase(Locale.ROOT),
                sanitizeLong(o.reloadQuietMs(), reloadQuietMs, 0L),
                sanitizeLong(o.reloadCeilingMs(), reloadCeilingMs, 0L),
                sanitizeLong(o.settleMs(), settleMs, 0L),
                sanitizeLong(o.launchBackoffMs(), launchBackoffMs, 1L),
                o.workDir() == null || o.workDir().isBlank() ? workDir : o.workDir().trim()
        );
        merged.validate();
        return merged;
    }

    public void validate() {
        checkPort("proxy port", proxyPort);
        checkPort("port range start", portRangeStart);
        checkPort("port range end", portRangeEnd);
        if (portRangeEnd <= portRangeStart) {
            throw new IllegalArgumentException(
                    "Port range end must be above start: start=" + portRangeStart + ", end=" + portRangeEnd);
        }
        // each pair holds two ports
        if ((long) poolSize * 2L > (long) portRangeEnd - portRangeStart + 1L) {
            throw new IllegalArgumentException(
                    "Port range " + portRangeStart + "-" + portRangeEnd + " is too small for " + poolSize + " pairs");
        }
        if (statsPort != 0) {
            checkPort("stats port", statsPort);
        }
        if (statusPort != 0) {
            checkPort("status port", statusPort);
        }
        if (!HaproxyDescriptor.BALANCE_POLICIES.contains(balance)) {
            throw new IllegalArgumentException("Unknown balance policy: " + balance + ", expected one of " + HaproxyDescriptor.BALANCE_POLICIES);
        }
        if (reloadCeilingMs < reloadQuietMs) {
            throw new IllegalArgumentException(
                    "Reload ceiling must not be below the quiet period: quiet=" + reloadQuietMs + "ms, ceiling=" + reloadCeilingMs + "ms");
        }
    }

    public TorotatorConfig toConfig() {
        return TorotatorConfig.fromWorkDir(workDir);
    }

    private static void checkPort(String name, int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("Invalid " + name + ": " + port);
        }
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    /**
     * Partial settings: {@code null} means "keep the underlying value". Used for both the JSON
     * settings file and the explicitly given command line options.
     */
    public record Overrides(
            Integer proxyPort,
            Integer poolSize,
            Integer portRangeStart,
            Integer portRangeEnd,
            Long maxProxyTimeSec,
            Long circuitTimeSec,
            Integer statsPort,
            Integer statusPort,
            Integer maxConn,
            String balance,
            Long reloadQuietMs,
            Long reloadCeilingMs,
            Long settleMs,
            Long launchBackoffMs,
            String workDir
    ) {
        public static Overrides none() {
            return new Overrides(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
        }
    }
}
