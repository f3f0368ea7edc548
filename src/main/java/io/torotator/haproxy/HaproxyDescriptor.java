package io.torotator.haproxy;

import java.util.List;
import java.util.Set;

public record HaproxyDescriptor(
        int port,
        int statsPort,
        int maxConn,
        String balance,
        List<Integer> backends
) {
    public static final Set<String> BALANCE_POLICIES = Set.of("roundrobin", "leastconn");

    public HaproxyDescriptor {
        backends = backends == null ? List.of() : List.copyOf(backends);
    }

    public boolean statsEnabled() {
        return statsPort > 0;
    }

    public HaproxyDescriptor withBackends(List<Integer> newBackends) {
        return new HaproxyDescriptor(port, statsPort, maxConn, balance, newBackends);
    }
}
