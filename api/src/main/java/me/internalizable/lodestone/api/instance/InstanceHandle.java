package me.internalizable.lodestone.api.instance;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Handle to one managed server instance.
 *
 * <p>Implemented by each server flavour. Getters return cheap snapshots and
 * may be called while the instance registry is locked; {@link #start()} and
 * {@link #stop()} may take a long time and must only be called after the
 * handle has been copied out of the registry.</p>
 */
public interface InstanceHandle {

    @Nonnull
    InstanceUuid getUuid();

    @Nonnull
    String getName();

    /**
     * Get the instance root directory.
     *
     * @return absolute root path
     */
    @Nonnull
    Path getPath();

    int getPort();

    @Nonnull
    GameType getGameType();

    @Nonnull
    String getFlavour();

    @Nonnull
    InstanceState getState();

    /**
     * Get the creation timestamp.
     *
     * @return epoch milliseconds
     */
    long getCreationTime();

    /**
     * Get an immutable snapshot of this instance.
     *
     * @return instance info
     */
    @Nonnull
    InstanceInfo getInstanceInfo();

    /**
     * Start the server process.
     *
     * @throws IOException if the process cannot be launched
     * @throws IllegalStateException if the instance is not stopped
     */
    void start() throws IOException;

    /**
     * Stop the server process and wait for it to exit.
     *
     * @throws IOException if the stop request cannot be delivered
     * @throws IllegalStateException if the instance is not running
     */
    void stop() throws IOException;
}
