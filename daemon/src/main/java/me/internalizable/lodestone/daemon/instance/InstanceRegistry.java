package me.internalizable.lodestone.daemon.instance;

import me.internalizable.lodestone.api.instance.InstanceHandle;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory table of live instances keyed by identity.
 *
 * <p>A single lock guards the table. Callers must not perform I/O or take
 * another store's lock inside {@link #inspect} or {@link #snapshot}. The one
 * exception is the {@link RemovalGuard} of {@link #removeIf}, which commits a
 * deletion and may touch the instance's marker file and the port table.</p>
 */
public class InstanceRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<InstanceUuid, InstanceHandle> instances = new LinkedHashMap<>();
    private final Set<String> reservedPrefixes = new HashSet<>();
    private final Map<InstanceUuid, Integer> activeOperations = new HashMap<>();

    // ==================== Identity Reservation ====================

    /**
     * Generate an identity whose short prefix is unused by registered instances
     * and by other in-flight creations, and reserve it.
     *
     * @return the reserved identity
     */
    @Nonnull
    public InstanceUuid reserveUuid() {
        lock.lock();
        try {
            while (true) {
                InstanceUuid candidate = InstanceUuid.generate();
                String prefix = candidate.shortPrefix();
                if (reservedPrefixes.contains(prefix) || prefixRegistered(prefix)) {
                    LOGGER.debug("Short prefix {} collides, regenerating", prefix);
                    continue;
                }
                reservedPrefixes.add(prefix);
                return candidate;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop a reservation made by {@link #reserveUuid()} without registering.
     *
     * @param uuid reserved identity
     */
    public void releaseReservation(@Nonnull InstanceUuid uuid) {
        lock.lock();
        try {
            reservedPrefixes.remove(uuid.shortPrefix());
        } finally {
            lock.unlock();
        }
    }

    private boolean prefixRegistered(String prefix) {
        for (InstanceUuid uuid : instances.keySet()) {
            if (uuid.shortPrefix().equals(prefix)) {
                return true;
            }
        }
        return false;
    }

    // ==================== Mutation ====================

    /**
     * Register an instance, clearing its identity reservation.
     *
     * @param handle the instance
     * @throws IllegalStateException if the identity is already registered
     */
    public void insert(@Nonnull InstanceHandle handle) {
        Objects.requireNonNull(handle, "handle");
        InstanceUuid uuid = handle.getUuid();
        lock.lock();
        try {
            if (instances.containsKey(uuid)) {
                throw new IllegalStateException("Instance already registered: " + uuid);
            }
            instances.put(uuid, handle);
            reservedPrefixes.remove(uuid.shortPrefix());
        } finally {
            lock.unlock();
        }
        LOGGER.debug("Registered instance {}", uuid);
    }

    /**
     * Unregister an instance if a guard allows it.
     *
     * <p>The guard runs under the registry lock together with the removal, so no
     * other registry operation can observe or start the instance in between. It
     * aborts the removal by throwing.</p>
     *
     * @param uuid instance identity
     * @param guard last checks and commit steps before the handle is dropped
     * @return the removed handle, or empty if absent
     */
    @Nonnull
    public Optional<InstanceHandle> removeIf(@Nonnull InstanceUuid uuid, @Nonnull RemovalGuard guard) {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(guard, "guard");
        lock.lock();
        try {
            InstanceHandle handle = instances.get(uuid);
            if (handle == null) {
                return Optional.empty();
            }
            guard.check(handle, activeOperations.containsKey(uuid));
            instances.remove(uuid);
            LOGGER.debug("Unregistered instance {}", uuid);
            return Optional.of(handle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Last checks before {@link #removeIf} drops a handle.
     */
    @FunctionalInterface
    public interface RemovalGuard {

        /**
         * @param handle the instance about to be removed
         * @param inUse whether a start or stop is running against it
         */
        void check(@Nonnull InstanceHandle handle, boolean inUse);
    }

    // ==================== Operations ====================

    /**
     * Look up an instance and mark an operation as running against it until
     * {@link #endOperation} is called. Removal guards see such instances as in use.
     *
     * @param uuid instance identity
     * @return the handle, or empty if absent
     */
    @Nonnull
    public Optional<InstanceHandle> beginOperation(@Nonnull InstanceUuid uuid) {
        Objects.requireNonNull(uuid, "uuid");
        lock.lock();
        try {
            InstanceHandle handle = instances.get(uuid);
            if (handle != null) {
                activeOperations.merge(uuid, 1, Integer::sum);
            }
            return Optional.ofNullable(handle);
        } finally {
            lock.unlock();
        }
    }

    public void endOperation(@Nonnull InstanceUuid uuid) {
        lock.lock();
        try {
            activeOperations.computeIfPresent(uuid, (key, count) -> count > 1 ? count - 1 : null);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Queries ====================

    @Nonnull
    public Optional<InstanceHandle> get(@Nonnull InstanceUuid uuid) {
        Objects.requireNonNull(uuid, "uuid");
        lock.lock();
        try {
            return Optional.ofNullable(instances.get(uuid));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(@Nonnull InstanceUuid uuid) {
        lock.lock();
        try {
            return instances.containsKey(uuid);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return instances.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of all registered handles.
     *
     * @return handles in registration order
     */
    @Nonnull
    public List<InstanceHandle> list() {
        lock.lock();
        try {
            return new ArrayList<>(instances.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a short read against one instance while holding the lock.
     *
     * @param uuid instance identity
     * @param reader copies what the caller needs out of the handle
     * @param <T> result type
     * @return the copied result, or empty if the instance is absent
     */
    @Nonnull
    public <T> Optional<T> inspect(@Nonnull InstanceUuid uuid, @Nonnull Function<InstanceHandle, T> reader) {
        lock.lock();
        try {
            InstanceHandle handle = instances.get(uuid);
            return handle != null ? Optional.ofNullable(reader.apply(handle)) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a short read against the whole table while holding the lock.
     *
     * @param reader copies what the caller needs out of the handles
     * @param <T> result type
     * @return the copied result
     */
    public <T> T snapshot(@Nonnull Function<Collection<InstanceHandle>, T> reader) {
        lock.lock();
        try {
            return reader.apply(instances.values());
        } finally {
            lock.unlock();
        }
    }
}
