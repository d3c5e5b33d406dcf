package me.internalizable.lodestone.daemon.flavour.minecraft;

import me.internalizable.lodestone.api.error.LodestoneException;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceHandle;
import me.internalizable.lodestone.api.instance.InstanceInfo;
import me.internalizable.lodestone.api.instance.InstanceState;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.process.ManagedProcess;
import me.internalizable.lodestone.daemon.process.ProcessManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A Minecraft Java server instance.
 *
 * <p>State transitions follow the server console: {@code STARTING} once the
 * process is spawned, {@code RUNNING} when the server prints its "Done ("
 * line, {@code STOPPED} after a requested stop or a clean exit and
 * {@code ERROR} after an unexpected exit.</p>
 */
public class MinecraftInstance implements InstanceHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(MinecraftInstance.class);

    static final String SERVER_JAR = "server.jar";
    static final String READY_MARKER = "Done (";
    static final String STOP_COMMAND = "stop";

    private final MinecraftConfig config;
    private final Path path;
    private final ProcessManager processManager;
    private final int gracefulStopTimeoutSeconds;

    private volatile InstanceState state = InstanceState.STOPPED;
    private volatile ManagedProcess process;

    public MinecraftInstance(@Nonnull MinecraftConfig config, @Nonnull Path path,
                             @Nonnull ProcessManager processManager, int gracefulStopTimeoutSeconds) {
        this.config = Objects.requireNonNull(config, "config");
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        this.processManager = Objects.requireNonNull(processManager, "processManager");
        this.gracefulStopTimeoutSeconds = gracefulStopTimeoutSeconds;
    }

    // ==================== Lifecycle ====================

    @Override
    public synchronized void start() throws IOException {
        if (state != InstanceState.STOPPED && state != InstanceState.ERROR) {
            throw LodestoneException.badRequest("Instance is already running");
        }
        if (!Files.isRegularFile(path.resolve(SERVER_JAR))) {
            throw new IOException(SERVER_JAR + " not found in instance directory");
        }

        List<String> command = processManager.javaCommand(config.minRam(), config.maxRam(), config.cmdArgs(),
                SERVER_JAR, List.of("nogui"));
        ManagedProcess spawned = processManager.spawn(config.uuid().value(), path, command);
        this.process = spawned;
        this.state = InstanceState.STARTING;

        spawned.addLineListener(line -> {
            if (state == InstanceState.STARTING && line.contains(READY_MARKER)) {
                state = InstanceState.RUNNING;
                LOGGER.info("Instance '{}' is running on port {}", config.name(), config.port());
            }
        });
        spawned.onExit().thenAccept(p -> onProcessExit(spawned, p.exitValue()));

        LOGGER.info("Starting instance '{}' ({}) as pid {}", config.name(), config.uuid(), spawned.getPid());
    }

    private void onProcessExit(ManagedProcess exited, int exitCode) {
        synchronized (this) {
            if (process != exited) {
                return;
            }
            if (state == InstanceState.STOPPING || exitCode == 0) {
                state = InstanceState.STOPPED;
            } else {
                state = InstanceState.ERROR;
                LOGGER.warn("Instance '{}' exited unexpectedly with code {}", config.name(), exitCode);
            }
        }
    }

    @Override
    public void stop() throws IOException {
        ManagedProcess running;
        synchronized (this) {
            if (state == InstanceState.STOPPED) {
                throw LodestoneException.badRequest("Instance is already stopped");
            }
            running = process;
            if (running == null || !running.isAlive()) {
                state = InstanceState.STOPPED;
                return;
            }
            state = InstanceState.STOPPING;
        }

        LOGGER.info("Stopping instance '{}' ({})", config.name(), config.uuid());
        processManager.stopProcess(running.getProcessId(), STOP_COMMAND, gracefulStopTimeoutSeconds);
        try {
            running.onExit().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while stopping instance", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Instance process did not exit", e);
        }

        synchronized (this) {
            if (process == running) {
                state = InstanceState.STOPPED;
            }
        }
    }

    // ==================== Accessors ====================

    @Nonnull
    @Override
    public InstanceUuid getUuid() {
        return config.uuid();
    }

    @Nonnull
    @Override
    public String getName() {
        return config.name();
    }

    @Nonnull
    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public int getPort() {
        return config.port();
    }

    @Nonnull
    @Override
    public GameType getGameType() {
        return config.gameType();
    }

    @Nonnull
    @Override
    public String getFlavour() {
        return config.gameType().getFlavour();
    }

    @Nonnull
    @Override
    public InstanceState getState() {
        return state;
    }

    @Override
    public long getCreationTime() {
        return config.creationTime();
    }

    @Nonnull
    @Override
    public InstanceInfo getInstanceInfo() {
        return new InstanceInfo(config.uuid(), config.name(), config.gameType(), getFlavour(),
                config.description(), config.port(), state, config.creationTime(), path.toString());
    }

    @Override
    public String toString() {
        return "MinecraftInstance{" +
                "uuid=" + config.uuid() +
                ", name='" + config.name() + '\'' +
                ", port=" + config.port() +
                ", state=" + state +
                '}';
    }
}
