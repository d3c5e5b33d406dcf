package me.internalizable.lodestone.daemon.port;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Tracks which network ports are claimed by instances.
 *
 * <p>Ports are chosen upstream from the instance manifest; this class only
 * records claims. A single monitor guards the claimed set.</p>
 */
public class PortAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PortAllocator.class);

    private final Set<Integer> allocatedPorts = new HashSet<>();

    /**
     * Mark a port as used. Reserving an already reserved port is a no-op.
     *
     * @param port port number
     */
    public synchronized void reserve(int port) {
        allocatedPorts.add(port);
        LOGGER.debug("Reserved port {}", port);
    }

    /**
     * Claim a port only if nobody holds it yet.
     *
     * @param port port number
     * @return true if the port was free and is now claimed
     */
    public synchronized boolean tryReserve(int port) {
        boolean claimed = allocatedPorts.add(port);
        if (claimed) {
            LOGGER.debug("Reserved port {}", port);
        }
        return claimed;
    }

    /**
     * Mark a port as free.
     *
     * @param port port number
     */
    public synchronized void release(int port) {
        if (allocatedPorts.remove(port)) {
            LOGGER.debug("Released port {}", port);
        }
    }

    public synchronized boolean isReserved(int port) {
        return allocatedPorts.contains(port);
    }

    /**
     * Get a copy of the claimed ports.
     *
     * @return snapshot of claimed ports
     */
    public synchronized Set<Integer> reservedPorts() {
        return Set.copyOf(allocatedPorts);
    }
}
