package me.internalizable.lodestone.daemon.flavour;

import me.internalizable.lodestone.daemon.event.EventBroadcaster;
import me.internalizable.lodestone.daemon.instance.DotLodestoneConfig;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything a provisioner needs to build an instance in its reserved directory.
 *
 * @param setupConfig validated settings
 * @param marker marker already written to the directory
 * @param path instance root
 * @param eventId progression id to report updates under
 * @param events event broadcaster
 */
public record ProvisioningContext(
        @Nonnull SetupConfig setupConfig,
        @Nonnull DotLodestoneConfig marker,
        @Nonnull Path path,
        long eventId,
        @Nonnull EventBroadcaster events
) {

    public ProvisioningContext {
        Objects.requireNonNull(setupConfig, "setupConfig");
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(events, "events");
    }

    /**
     * Report progress on the creation this context belongs to.
     *
     * @param message progress message
     * @param progress work units completed
     */
    public void reportProgress(@Nonnull String message, double progress) {
        events.send(events.newProgressionUpdate(eventId, message, progress));
    }
}
