package io.torotator.port;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out TCP ports from {@code [floor, ceiling]} in ascending order, wrapping back to the floor.
 * A port stays leased until {@link #release(int)} and is skipped while leased.
 */
public final class PortAllocator {
    private static final Logger LOG = LogManager.getLogger(PortAllocator.class);

    private final int floor;
    private final int ceiling;
    private final Object lock = new Object();
    private final Set<Integer> leased = new HashSet<>();
    private int nextPort;

    public PortAllocator(int floor, int ceiling) {
        if (floor < 1 || ceiling > 65_535 || ceiling < floor) {
            throw new IllegalArgumentException("Invalid port range: " + floor + "-" + ceiling);
        }
        this.floor = floor;
        this.ceiling = ceiling;
        this.nextPort = floor;
    }

    public int lease() {
        synchronized (lock) {
            int rangeSize = ceiling - floor + 1;
            for (int i = 0; i < rangeSize; i++) {
                int candidate = nextPort;
                nextPort = candidate >= ceiling ? floor : candidate + 1;
                if (nextPort == floor) {
                    LOG.debug("Port counter wrapped to {}", floor);
                }
                if (leased.add(candidate)) {
                    return candidate;
                }
            }
            throw new PortExhaustedException(floor, ceiling, leased.size());
        }
    }

    public void release(int port) {
        synchronized (lock) {
            if (!leased.remove(port)) {
                LOG.debug("Released port {} was not leased", port);
            }
        }
    }

    public boolean isLeased(int port) {
        synchronized (lock) {
            return leased.contains(port);
        }
    }

    public int leasedCount() {
        synchronized (lock) {
            return leased.size();
        }
    }

    public int floor() {
        return floor;
    }

    public int ceiling() {
        return ceiling;
    }
}
