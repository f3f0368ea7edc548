package io.torotator.observability;

import io.torotator.config.TorotatorConfig;
import io.torotator.haproxy.BackendRegistry;
import io.torotator.haproxy.ReverseProxyController;
import io.torotator.pool.RotationScheduler;
import io.torotator.port.PortAllocator;
import io.torotator.worker.RetireReason;
import io.torotator.worker.WorkerPair;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record PoolStatus(
        String version,
        String generatedAt,
        int capacity,
        int admitted,
        List<Integer> backends,
        int portsLeased,
        long haproxyPid,
        String reloadState,
        long reloadRequests,
        long reloadsCompleted,
        long reloadsFailed,
        long pairsStarted,
        long pairsRegistered,
        long launchFailures,
        Map<RetireReason, Long> retiredByReason,
        List<WorkerPair.View> pairs
) {
    public static PoolStatus capture(
            RotationScheduler scheduler,
            ReverseProxyController controller,
            BackendRegistry registry,
            PortAllocator ports
    ) {
        return new PoolStatus(
                TorotatorConfig.VERSION,
                Instant.now().toString(),
                scheduler.capacity(),
                scheduler.admitted(),
                registry.snapshot(),
                ports.leasedCount(),
                controller.pid(),
                controller.state().name(),
                controller.reloadRequests(),
                controller.reloadsCompleted(),
                controller.reloadsFailed(),
                scheduler.pairsStarted(),
                scheduler.pairsRegistered(),
                scheduler.launchFailures(),
                scheduler.retiredByReason(),
                scheduler.livePairs()
        );
    }
}
