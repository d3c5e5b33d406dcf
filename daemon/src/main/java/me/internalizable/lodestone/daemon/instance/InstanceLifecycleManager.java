package me.internalizable.lodestone.daemon.instance;

import me.internalizable.lodestone.api.error.LodestoneException;
import me.internalizable.lodestone.api.error.PartialDeletionException;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceHandle;
import me.internalizable.lodestone.api.instance.InstanceInfo;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.auth.User;
import me.internalizable.lodestone.daemon.auth.UserAction;
import me.internalizable.lodestone.daemon.auth.UserStore;
import me.internalizable.lodestone.daemon.event.CausedBy;
import me.internalizable.lodestone.daemon.event.EventBroadcaster;
import me.internalizable.lodestone.daemon.event.ProgressionEndValue;
import me.internalizable.lodestone.daemon.event.ProgressionStart;
import me.internalizable.lodestone.daemon.event.ProgressionStartValue;
import me.internalizable.lodestone.daemon.flavour.FlavourProvisioner;
import me.internalizable.lodestone.daemon.flavour.FlavourRegistry;
import me.internalizable.lodestone.daemon.flavour.ProvisioningContext;
import me.internalizable.lodestone.daemon.flavour.SetupConfig;
import me.internalizable.lodestone.daemon.fs.FileTrees;
import me.internalizable.lodestone.daemon.fs.ScopedPaths;
import me.internalizable.lodestone.daemon.port.PortAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Drives instance creation, deletion, start and stop.
 *
 * <p>Creation validates and reserves synchronously, then provisions on a
 * background thread that outlives the request. Registry, port table and user
 * store locks are each held only briefly. Deletion is the one operation that
 * touches the marker file and the port table while holding the registry lock.</p>
 */
public class InstanceLifecycleManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceLifecycleManager.class);

    private static final double TOTAL_WORK = 10.0;

    private final Path instancesDirectory;
    private final InstanceRegistry registry;
    private final PortAllocator ports;
    private final EventBroadcaster events;
    private final FlavourRegistry flavours;
    private final UserStore users;
    private final DirectoryRemover directoryRemover;
    private final ExecutorService provisioningExecutor;

    /**
     * Create a lifecycle manager.
     *
     * @param instancesDirectory directory holding all instance roots
     * @param registry instance registry
     * @param ports port allocator
     * @param events event broadcaster
     * @param flavours provisioners by game type
     * @param users user store receiving creator grants
     */
    public InstanceLifecycleManager(
            @Nonnull Path instancesDirectory,
            @Nonnull InstanceRegistry registry,
            @Nonnull PortAllocator ports,
            @Nonnull EventBroadcaster events,
            @Nonnull FlavourRegistry flavours,
            @Nonnull UserStore users) {
        this(instancesDirectory, registry, ports, events, flavours, users, DirectoryRemover.DEFAULT);
    }

    InstanceLifecycleManager(
            @Nonnull Path instancesDirectory,
            @Nonnull InstanceRegistry registry,
            @Nonnull PortAllocator ports,
            @Nonnull EventBroadcaster events,
            @Nonnull FlavourRegistry flavours,
            @Nonnull UserStore users,
            @Nonnull DirectoryRemover directoryRemover) {
        this.instancesDirectory = Objects.requireNonNull(instancesDirectory, "instancesDirectory")
                .toAbsolutePath().normalize();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ports = Objects.requireNonNull(ports, "ports");
        this.events = Objects.requireNonNull(events, "events");
        this.flavours = Objects.requireNonNull(flavours, "flavours");
        this.users = Objects.requireNonNull(users, "users");
        this.directoryRemover = Objects.requireNonNull(directoryRemover, "directoryRemover");

        this.provisioningExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "Lodestone-Provisioning");
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== Restore ====================

    /**
     * Register every instance found under the instances directory.
     *
     * <p>Directories without a readable marker are skipped.</p>
     *
     * @return number of restored instances
     * @throws IOException if the instances directory cannot be created or listed
     */
    public int restoreInstances() throws IOException {
        Files.createDirectories(instancesDirectory);
        int restored = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(instancesDirectory)) {
            for (Path entry : stream) {
                if (!Files.isDirectory(entry)) {
                    continue;
                }
                if (!Files.isRegularFile(entry.resolve(DotLodestoneConfig.FILE_NAME))) {
                    LOGGER.warn("Skipping {}: no {} marker", entry.getFileName(), DotLodestoneConfig.FILE_NAME);
                    continue;
                }
                try {
                    restoreInstance(entry);
                    restored++;
                } catch (IOException | RuntimeException e) {
                    LOGGER.warn("Failed to restore instance from {}: {}", entry.getFileName(), e.getMessage());
                }
            }
        }
        LOGGER.info("Restored {} instance(s) from {}", restored, instancesDirectory);
        return restored;
    }

    private void restoreInstance(Path directory) throws IOException {
        DotLodestoneConfig marker = DotLodestoneConfig.read(directory);
        FlavourProvisioner provisioner = flavours.get(marker.gameType())
                .orElseThrow(() -> new IOException("No provisioner for " + marker.gameType().getId()));
        if (registry.contains(marker.uuid())) {
            throw new IOException("Duplicate instance identity " + marker.uuid());
        }

        InstanceHandle handle = provisioner.restore(directory, marker);
        ports.reserve(handle.getPort());
        registry.insert(handle);
        LOGGER.info("Restored instance {} ({}) on port {}", handle.getName(), handle.getUuid(), handle.getPort());
    }

    // ==================== Queries ====================

    /**
     * List the instances a requester may view.
     *
     * @param requester authenticated requester
     * @return visible instances, oldest first
     */
    @Nonnull
    public List<InstanceInfo> listInstances(@Nonnull User requester) {
        List<InstanceInfo> visible = registry.snapshot(handles -> {
            List<InstanceInfo> result = new ArrayList<>();
            for (InstanceHandle handle : handles) {
                if (requester.canPerform(UserAction.viewInstance(handle.getUuid()))) {
                    result.add(handle.getInstanceInfo());
                }
            }
            return result;
        });
        visible.sort(Comparator.comparingLong(InstanceInfo::creationTime));
        return visible;
    }

    /**
     * Get one instance's info.
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     * @return instance info
     */
    @Nonnull
    public InstanceInfo getInstanceInfo(@Nonnull User requester, @Nonnull InstanceUuid uuid) {
        InstanceInfo info = registry.inspect(uuid, InstanceHandle::getInstanceInfo)
                .orElseThrow(() -> LodestoneException.notFound("Instance not found"));
        requester.tryAction(UserAction.viewInstance(uuid));
        return info;
    }

    // ==================== Creation ====================

    /**
     * Accept a creation request.
     *
     * <p>Validates the manifest, reserves identity, port and directory, writes
     * the marker, then hands provisioning to a background task. On return the
     * instance is not yet registered.</p>
     *
     * @param requester authenticated requester
     * @param gameType requested game type
     * @param manifest user-supplied settings
     * @return the new identity and the provisioning task
     */
    @Nonnull
    public PendingInstance createInstance(@Nonnull User requester, @Nonnull GameType gameType,
                                          @Nonnull Map<String, Object> manifest) {
        requester.tryAction(UserAction.createInstance());

        FlavourProvisioner provisioner = flavours.get(gameType)
                .orElseThrow(() -> LodestoneException.badRequest("Unsupported game type: " + gameType.getId()));

        InstanceUuid uuid = registry.reserveUuid();
        SetupConfig setupConfig;
        try {
            setupConfig = provisioner.buildSetupConfig(gameType, manifest);
        } catch (RuntimeException e) {
            registry.releaseReservation(uuid);
            throw e;
        }

        int port = setupConfig.port();
        if (!ports.tryReserve(port)) {
            registry.releaseReservation(uuid);
            throw LodestoneException.badRequest("Port " + port + " is already in use");
        }

        Path setupPath;
        try {
            setupPath = ScopedPaths.resolve(instancesDirectory, setupConfig.name() + "-" + uuid.shortPrefix());
            Files.createDirectories(setupPath);
        } catch (IOException e) {
            abandonReservation(uuid, port);
            throw LodestoneException.ioFailure("Failed to create instance directory", e);
        } catch (RuntimeException e) {
            abandonReservation(uuid, port);
            throw e;
        }

        DotLodestoneConfig marker = new DotLodestoneConfig(uuid, gameType);
        try {
            marker.write(setupPath);
        } catch (IOException e) {
            abandonReservation(uuid, port);
            try {
                directoryRemover.deleteRecursively(setupPath);
            } catch (IOException cleanup) {
                LOGGER.error("Failed to remove {} after marker write failed", setupPath, cleanup);
            }
            throw LodestoneException.ioFailure("Failed to write " + DotLodestoneConfig.FILE_NAME + " file", e);
        }

        CausedBy causedBy = CausedBy.user(requester);
        ProgressionStart start = events.newProgressionStart(
                "Setting up instance " + setupConfig.name(),
                uuid,
                TOTAL_WORK,
                new ProgressionStartValue.InstanceCreation(uuid, setupConfig.name(), port, gameType),
                causedBy);
        events.send(start.event());

        ProvisioningContext context = new ProvisioningContext(setupConfig, marker, setupPath, start.eventId(), events);
        CompletableFuture<Void> provisioning = CompletableFuture.runAsync(
                () -> provision(provisioner, context, requester, causedBy), provisioningExecutor);

        LOGGER.info("Accepted creation of {} instance {} ({}) on port {}",
                gameType.getId(), setupConfig.name(), uuid, port);
        return new PendingInstance(uuid, provisioning);
    }

    private void provision(FlavourProvisioner provisioner, ProvisioningContext context, User requester,
                           CausedBy causedBy) {
        InstanceUuid uuid = context.marker().uuid();
        int port = context.setupConfig().port();

        InstanceHandle handle;
        try {
            handle = provisioner.provision(context);
        } catch (Exception e) {
            LOGGER.warn("Provisioning of instance {} failed: {}", uuid, e.getMessage());
            events.send(events.newProgressionEnd(context.eventId(), false,
                    "Instance creation failed: " + describe(e), null));
            abandonReservation(uuid, port);
            try {
                directoryRemover.deleteRecursively(context.path());
            } catch (IOException cleanup) {
                LOGGER.error("Failed to remove directory {} after instance creation failed", context.path(), cleanup);
                throw new UncheckedIOException("Failed to remove directory after instance creation failed", cleanup);
            }
            return;
        }

        events.send(events.newProgressionEnd(context.eventId(), true, "Instance created successfully",
                new ProgressionEndValue.InstanceCreation(handle.getInstanceInfo())));
        ports.reserve(port);

        try {
            users.grantInstanceOwnership(requester.getUid(), uuid, causedBy);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Failed to update permissions of {} for instance {}: {}",
                    requester.getUsername(), uuid, e.getMessage());
        }

        registry.insert(handle);
        LOGGER.info("Instance {} ({}) created", handle.getName(), uuid);
    }

    private void abandonReservation(InstanceUuid uuid, int port) {
        ports.release(port);
        registry.releaseReservation(uuid);
    }

    private static String describe(Exception e) {
        if (e instanceof LodestoneException) {
            return ((LodestoneException) e).getDetail();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // ==================== Deletion ====================

    /**
     * Delete a stopped instance.
     *
     * <p>The state check, marker removal, port release and unregistration happen
     * under the registry lock, so a concurrent start or delete cannot interleave.
     * Removing the marker is the commit point. The remaining files are removed
     * after the lock is released; if that fails the instance stays unregistered
     * and {@link PartialDeletionException} is thrown.</p>
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     */
    public void deleteInstance(@Nonnull User requester, @Nonnull InstanceUuid uuid) {
        requester.tryAction(UserAction.deleteInstance());

        CausedBy causedBy = CausedBy.user(requester);
        Deletion deletion = new Deletion();
        InstanceHandle removed = registry.removeIf(uuid, (handle, inUse) -> {
            if (inUse || !handle.getState().isDeletable()) {
                throw LodestoneException.badRequest("Instance must be stopped before deletion");
            }

            ProgressionStart start = events.newProgressionStart(
                    "Deleting instance " + handle.getName(),
                    uuid,
                    TOTAL_WORK,
                    new ProgressionStartValue.InstanceDelete(uuid),
                    causedBy);
            events.send(start.event());
            deletion.eventId = start.eventId();

            try {
                Files.delete(handle.getPath().resolve(DotLodestoneConfig.FILE_NAME));
            } catch (IOException e) {
                events.send(events.newProgressionEnd(start.eventId(), false,
                        "Failed to delete " + DotLodestoneConfig.FILE_NAME + ". Instance not deleted", null));
                throw LodestoneException.ioFailure(
                        "Failed to delete " + DotLodestoneConfig.FILE_NAME + " file. Instance not deleted", e);
            }
            ports.release(handle.getPort());
        }).orElseThrow(() -> LodestoneException.notFound("Instance not found"));

        Path path = removed.getPath();
        try {
            directoryRemover.deleteRecursively(path);
        } catch (IOException e) {
            events.send(events.newProgressionEnd(deletion.eventId, false,
                    "Failed to delete some or all of instance's files: " + e.getMessage(), null));
            LOGGER.warn("Instance {} unregistered but files under {} remain: {}", uuid, path, e.getMessage());
            throw new PartialDeletionException(uuid, "Failed to delete some or all of instance's files", e);
        }

        events.send(events.newProgressionEnd(deletion.eventId, true, "Instance deleted successfully",
                new ProgressionEndValue.InstanceDelete(uuid)));
        LOGGER.info("Instance {} ({}) deleted", removed.getName(), uuid);
    }

    private static final class Deletion {
        private long eventId;
    }

    // ==================== Start / Stop ====================

    /**
     * Start an instance. A deletion of the same instance is refused while this runs.
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     */
    public void startInstance(@Nonnull User requester, @Nonnull InstanceUuid uuid) {
        requester.tryAction(UserAction.startInstance(uuid));
        InstanceHandle handle = registry.beginOperation(uuid)
                .orElseThrow(() -> LodestoneException.notFound("Instance not found"));
        try {
            handle.start();
        } catch (IOException e) {
            throw LodestoneException.ioFailure("Failed to start instance", e);
        } finally {
            registry.endOperation(uuid);
        }
    }

    /**
     * Stop an instance.
     *
     * @param requester authenticated requester
     * @param uuid instance identity
     */
    public void stopInstance(@Nonnull User requester, @Nonnull InstanceUuid uuid) {
        requester.tryAction(UserAction.stopInstance(uuid));
        InstanceHandle handle = registry.beginOperation(uuid)
                .orElseThrow(() -> LodestoneException.notFound("Instance not found"));
        try {
            handle.stop();
        } catch (IOException e) {
            throw LodestoneException.ioFailure("Failed to stop instance", e);
        } finally {
            registry.endOperation(uuid);
        }
    }

    // ==================== Shutdown ====================

    /**
     * Stop every running instance and the provisioning pool.
     */
    public void shutdown() {
        LOGGER.info("Shutting down instance lifecycle manager...");

        for (InstanceHandle handle : registry.list()) {
            if (handle.getState().isProcessExpected()) {
                try {
                    handle.stop();
                } catch (IOException | RuntimeException e) {
                    LOGGER.warn("Error stopping instance '{}': {}", handle.getName(), e.getMessage());
                }
            }
        }

        provisioningExecutor.shutdown();
        try {
            if (!provisioningExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Provisioning tasks still running at shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOGGER.info("Instance lifecycle manager shut down");
    }

    /**
     * Removes an instance directory tree.
     */
    @FunctionalInterface
    interface DirectoryRemover {

        DirectoryRemover DEFAULT = FileTrees::deleteRecursively;

        void deleteRecursively(@Nonnull Path path) throws IOException;
    }

    @Nonnull
    public Path getInstancesDirectory() {
        return instancesDirectory;
    }
}
