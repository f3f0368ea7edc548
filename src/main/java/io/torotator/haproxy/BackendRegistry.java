package io.torotator.haproxy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The ports currently eligible to receive traffic from HAProxy. Every mutation is followed by a
 * reload request; the request is fire-and-forget and is issued after the lock is released.
 */
public final class BackendRegistry {
    private static final Logger LOG = LogManager.getLogger(BackendRegistry.class);

    private final Object lock = new Object();
    private final Set<Integer> ports = new TreeSet<>();
    private volatile Runnable changeListener = () -> { };

    void onChange(Runnable listener) {
        this.changeListener = listener == null ? () -> { } : listener;
    }

    public void register(int port) {
        boolean added;
        synchronized (lock) {
            added = ports.add(port);
        }
        LOG.info("Backend {} registered (new={})", port, added);
        changeListener.run();
    }

    public void deregister(int port) {
        boolean removed;
        synchronized (lock) {
            removed = ports.remove(port);
        }
        LOG.info("Backend {} deregistered (present={})", port, removed);
        changeListener.run();
    }

    public boolean contains(int port) {
        synchronized (lock) {
            return ports.contains(port);
        }
    }

    /**
     * Sorted copy of the registered ports.
     */
    public List<Integer> snapshot() {
        synchronized (lock) {
            return List.copyOf(ports);
        }
    }

    public int size() {
        synchronized (lock) {
            return ports.size();
        }
    }
}
