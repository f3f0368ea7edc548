package io.torotator.port;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PortAllocatorTest {
    @Test
    void leasesAscendingFromFloor() {
        PortAllocator ports = new PortAllocator(30_000, 30_010);
        assertEquals(30_000, ports.lease());
        assertEquals(30_001, ports.lease());
        assertEquals(30_002, ports.lease());
        assertEquals(3, ports.leasedCount());
    }

    @Test
    void wrapsToFloorAndSkipsLeasedPorts() {
        PortAllocator ports = new PortAllocator(40_000, 40_003);
        int a = ports.lease();
        int b = ports.lease();
        int c = ports.lease();
        int d = ports.lease();
        assertEquals(40_003, d);

        ports.release(b);
        ports.release(d);
        // counter wrapped; 40000 and 40002 are still in use
        assertEquals(b, ports.lease());
        assertEquals(d, ports.lease());
        assertTrue(ports.isLeased(a));
        assertTrue(ports.isLeased(c));
    }

    @Test
    void exhaustedRangeThrows() {
        PortAllocator ports = new PortAllocator(50_000, 50_001);
        ports.lease();
        ports.lease();
        PortExhaustedException e = assertThrows(PortExhaustedException.class, ports::lease);
        assertTrue(e.getMessage().contains("50000"), e.getMessage());
    }

    @Test
    void releaseOfUnleasedPortIsIgnored() {
        PortAllocator ports = new PortAllocator(31_000, 31_005);
        ports.release(31_003);
        assertFalse(ports.isLeased(31_003));
        assertEquals(0, ports.leasedCount());
    }

    @Test
    void rejectsInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(100, 99));
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(65_000, 70_000));
    }

    @Test
    void concurrentLeasesNeverCollide() throws Exception {
        PortAllocator ports = new PortAllocator(30_000, 65_535);
        Set<Integer> seen = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 8; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < 250; i++) {
                        seen.add(ports.lease());
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(2_000, seen.size());
        assertEquals(2_000, ports.leasedCount());
        Set<Integer> expected = new HashSet<>();
        for (int p = 30_000; p < 32_000; p++) {
            expected.add(p);
        }
        assertEquals(expected, seen);
    }
}
