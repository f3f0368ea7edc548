package io.torotator.observability;

import io.torotator.worker.RetireReason;

import java.util.Locale;
import java.util.Map;

public final class PoolMetricsFormatter {
    private PoolMetricsFormatter() {
    }

    public static String format(PoolStatus status) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "torotator_pool_capacity", "Maximum number of live worker pairs", null, null, status.capacity());
        appendGauge(sb, "torotator_pool_admitted", "Worker pairs currently holding an admission slot", null, null, status.admitted());
        appendGauge(sb, "torotator_backends", "Backend ports registered with HAProxy", null, null, status.backends().size());
        appendGauge(sb, "torotator_ports_leased", "Ports currently leased from the allocator", null, null, status.portsLeased());
        appendGauge(sb, "torotator_haproxy_pid", "Process id of the serving HAProxy instance", null, null, status.haproxyPid());
        appendGauge(sb, "torotator_reload_requests_total", "HAProxy reload requests received", null, null, status.reloadRequests());
        appendGauge(sb, "torotator_reloads_total", "HAProxy reloads grouped by result", "result", "ok", status.reloadsCompleted());
        appendGauge(sb, "torotator_reloads_total", "HAProxy reloads grouped by result", "result", "failed", status.reloadsFailed());
        appendGauge(sb, "torotator_pairs_started_total", "Worker pair tasks admitted", null, null, status.pairsStarted());
        appendGauge(sb, "torotator_pairs_registered_total", "Worker pairs that became reachable", null, null, status.pairsRegistered());
        appendGauge(sb, "torotator_launch_failures_total", "Failed circuit or forwarder launches", null, null, status.launchFailures());
        appendMapGauge(sb, "torotator_pairs_retired_total", "Retired worker pairs grouped by reason", "reason", status.retiredByReason());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<RetireReason, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<RetireReason, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey().name().toLowerCase(Locale.ROOT))).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String raw) {
        return raw.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
