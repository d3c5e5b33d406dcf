package me.internalizable.lodestone.daemon;

import me.internalizable.lodestone.api.LodestoneAPI;
import me.internalizable.lodestone.daemon.api.LodestoneAPIImpl;
import me.internalizable.lodestone.daemon.auth.UserStore;
import me.internalizable.lodestone.daemon.config.DaemonConfig;
import me.internalizable.lodestone.daemon.event.EventBroadcaster;
import me.internalizable.lodestone.daemon.flavour.FlavourRegistry;
import me.internalizable.lodestone.daemon.flavour.minecraft.MinecraftProvisioner;
import me.internalizable.lodestone.daemon.fs.InstanceFileService;
import me.internalizable.lodestone.daemon.http.LodestoneHttpServer;
import me.internalizable.lodestone.daemon.instance.InstanceLifecycleManager;
import me.internalizable.lodestone.daemon.instance.InstanceRegistry;
import me.internalizable.lodestone.daemon.port.PortAllocator;
import me.internalizable.lodestone.daemon.process.ProcessManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Wires the daemon's components together and owns their lifecycle.
 *
 * <h2>Directory Structure</h2>
 * <pre>
 * &lt;root&gt;/
 * ├── lodestone.yml        # Daemon configuration
 * ├── users.yml            # Users, tokens and permissions
 * ├── instances/           # One directory per instance
 * │   └── survival-1a2b3c4d/
 * │       ├── .lodestone_config
 * │       └── server.jar
 * └── logs/                # Game server console logs
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * LodestoneDaemon daemon = new LodestoneDaemon(Path.of("lodestone"));
 * daemon.initialize();
 * daemon.start();
 * ...
 * daemon.shutdown();
 * }</pre>
 */
public class LodestoneDaemon {

    private static final Logger LOGGER = LoggerFactory.getLogger(LodestoneDaemon.class);

    private final Path root;

    private DaemonConfig config;
    private UserStore userStore;
    private EventBroadcaster eventBroadcaster;
    private InstanceRegistry registry;
    private ProcessManager processManager;
    private InstanceLifecycleManager lifecycleManager;
    private LodestoneAPI api;
    private LodestoneHttpServer httpServer;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    public LodestoneDaemon(@Nonnull Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    // ==================== Initialization ====================

    /**
     * Load configuration and users, build components and restore instances.
     *
     * @throws IOException if initialization fails
     */
    public void initialize() throws IOException {
        if (initialized) {
            throw new IllegalStateException("Daemon already initialized");
        }

        LOGGER.info("Initializing Lodestone daemon in {}", root);
        Files.createDirectories(root);

        config = DaemonConfig.load(root.resolve(DaemonConfig.FILE_NAME));
        LOGGER.info("Loaded daemon configuration");

        userStore = new UserStore(DaemonConfig.resolve(root, config.getUsersFile()));
        userStore.load();

        eventBroadcaster = new EventBroadcaster(config.getEvents().getSubscriberBufferCapacity());
        registry = new InstanceRegistry();
        PortAllocator ports = new PortAllocator();

        processManager = new ProcessManager(DaemonConfig.resolve(root, config.getLogsDirectory()),
                config.getProcess().getJavaPath());
        processManager.initialize();

        FlavourRegistry flavours = new FlavourRegistry();
        flavours.register(new MinecraftProvisioner(processManager,
                config.getProcess().getGracefulStopTimeoutSeconds()));
        LOGGER.info("Serving game types {}", flavours.getSupportedGameTypes());

        lifecycleManager = new InstanceLifecycleManager(
                DaemonConfig.resolve(root, config.getInstancesDirectory()),
                registry,
                ports,
                eventBroadcaster,
                flavours,
                userStore
        );
        lifecycleManager.restoreInstances();

        api = new LodestoneAPIImpl(userStore, lifecycleManager, new InstanceFileService(registry));
        httpServer = new LodestoneHttpServer(api, config.getHttp().getHost(), config.getHttp().getPort());

        initialized = true;
        LOGGER.info("Lodestone daemon initialized with {} instance(s)", registry.size());
    }

    /**
     * Start serving HTTP.
     *
     * @throws IOException if the listener cannot be bound
     */
    public void start() throws IOException {
        if (!initialized) {
            throw new IllegalStateException("Daemon not initialized");
        }
        httpServer.start();
    }

    // ==================== Shutdown ====================

    /**
     * Stop serving, stop all instances and terminate leftover processes.
     */
    public void shutdown() {
        if (shutdown || !initialized) {
            return;
        }
        shutdown = true;

        LOGGER.info("Shutting down Lodestone daemon...");
        httpServer.stop();
        lifecycleManager.shutdown();
        processManager.shutdown();
        LOGGER.info("Lodestone daemon shut down");
    }

    // ==================== Accessors ====================

    @Nonnull
    public Path getRoot() {
        return root;
    }

    public DaemonConfig getConfig() {
        return config;
    }

    public LodestoneAPI getApi() {
        return api;
    }

    public EventBroadcaster getEventBroadcaster() {
        return eventBroadcaster;
    }

    public UserStore getUserStore() {
        return userStore;
    }

    public InstanceRegistry getRegistry() {
        return registry;
    }

    public LodestoneHttpServer getHttpServer() {
        return httpServer;
    }

    public boolean isInitialized() {
        return initialized;
    }
}
