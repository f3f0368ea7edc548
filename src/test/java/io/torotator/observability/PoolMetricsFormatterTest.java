package io.torotator.observability;

import io.torotator.worker.RetireReason;
import io.torotator.worker.WorkerPair;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PoolMetricsFormatterTest {
    static PoolStatus sampleStatus() {
        Map<RetireReason, Long> retired = new EnumMap<>(RetireReason.class);
        for (RetireReason reason : RetireReason.values()) {
            retired.put(reason, 0L);
        }
        retired.put(RetireReason.EXPIRED, 4L);
        return new PoolStatus(
                "0.2.0",
                "2026-10-17T00:00:00Z",
                3,
                3,
                List.of(30_001, 30_003),
                6,
                4242L,
                "IDLE",
                9L,
                7L,
                1L,
                8L,
                7L,
                2L,
                retired,
                List.of(new WorkerPair.View(5L, "REGISTERED", 30_000, 30_001, 101L, 102L, "2026-10-17T00:00:00Z", 1))
        );
    }

    @Test
    void rendersGaugesWithLabels() {
        String text = PoolMetricsFormatter.format(sampleStatus());

        assertTrue(text.contains("torotator_pool_capacity 3\n"), text);
        assertTrue(text.contains("torotator_backends 2\n"), text);
        assertTrue(text.contains("torotator_haproxy_pid 4242\n"), text);
        assertTrue(text.contains("torotator_reloads_total{result=\"ok\"} 7\n"), text);
        assertTrue(text.contains("torotator_reloads_total{result=\"failed\"} 1\n"), text);
        assertTrue(text.contains("torotator_pairs_retired_total{reason=\"expired\"} 4\n"), text);
        assertTrue(text.contains("torotator_pairs_retired_total{reason=\"circuit_exited\"} 0\n"), text);
    }

    @Test
    void helpAndTypeAppearOncePerMetric() {
        String text = PoolMetricsFormatter.format(sampleStatus());
        assertEquals(text.indexOf("# TYPE torotator_reloads_total gauge"), text.lastIndexOf("# TYPE torotator_reloads_total gauge"));
        assertEquals(text.indexOf("# HELP torotator_pairs_retired_total"), text.lastIndexOf("# HELP torotator_pairs_retired_total"));
    }
}
