package me.internalizable.lodestone.daemon.port;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link PortAllocator}.
 */
class PortAllocatorTest {

    private PortAllocator ports;

    @BeforeEach
    void setUp() {
        ports = new PortAllocator();
    }

    @Test
    @DisplayName("reserve then release frees the port")
    void reserveThenRelease() {
        ports.reserve(25565);
        assertTrue(ports.isReserved(25565));

        ports.release(25565);
        assertFalse(ports.isReserved(25565));
    }

    @Test
    @DisplayName("reserve is idempotent")
    void reserveIsIdempotent() {
        ports.reserve(25565);
        ports.reserve(25565);
        assertEquals(Set.of(25565), ports.reservedPorts());
    }

    @Test
    @DisplayName("releasing an unknown port is a no-op")
    void releaseUnknownPort() {
        ports.release(1234);
        assertTrue(ports.reservedPorts().isEmpty());
    }

    @Test
    @DisplayName("tryReserve refuses a held port")
    void tryReserveRefusesHeldPort() {
        assertTrue(ports.tryReserve(25565));
        assertFalse(ports.tryReserve(25565));
    }

    @Test
    @DisplayName("only one of many concurrent tryReserve calls wins")
    void concurrentTryReserve() throws InterruptedException {
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Thread> workers = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            Thread t = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (ports.tryReserve(30000)) {
                    winners.incrementAndGet();
                }
            });
            workers.add(t);
            t.start();
        }
        start.countDown();
        for (Thread t : workers) {
            t.join();
        }
        assertEquals(1, winners.get());
    }
}
