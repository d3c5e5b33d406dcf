package me.internalizable.lodestone.daemon.flavour;

import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceHandle;
import me.internalizable.lodestone.daemon.instance.DotLodestoneConfig;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Builds and restores instances of one or more game types.
 */
public interface FlavourProvisioner {

    /**
     * Game types this provisioner handles.
     *
     * @return supported game types
     */
    @Nonnull
    Set<GameType> supportedGameTypes();

    /**
     * Validate a user manifest.
     *
     * @param gameType requested game type
     * @param manifest user-supplied settings
     * @return validated settings
     * @throws me.internalizable.lodestone.api.error.LodestoneException with BAD_REQUEST if malformed
     */
    @Nonnull
    SetupConfig buildSetupConfig(@Nonnull GameType gameType, @Nonnull Map<String, Object> manifest);

    /**
     * Set up a new instance in its already reserved directory.
     *
     * <p>Runs on a background thread and may take long.</p>
     *
     * @param context provisioning context
     * @return handle for the ready instance
     * @throws IOException if setup fails
     */
    @Nonnull
    InstanceHandle provision(@Nonnull ProvisioningContext context) throws IOException;

    /**
     * Rebuild a handle for an instance found on disk.
     *
     * @param path instance root
     * @param marker marker read from the directory
     * @return handle in the stopped state
     * @throws IOException if the instance's own settings cannot be read
     */
    @Nonnull
    InstanceHandle restore(@Nonnull Path path, @Nonnull DotLodestoneConfig marker) throws IOException;
}
