package me.internalizable.lodestone.api.error;

import me.internalizable.lodestone.api.instance.InstanceUuid;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Raised when an instance was unregistered but some of its files could not be removed.
 *
 * <p>The deletion itself has committed; only orphaned files remain on disk.</p>
 */
public class PartialDeletionException extends LodestoneException {

    private final InstanceUuid uuid;

    public PartialDeletionException(@Nonnull InstanceUuid uuid, @Nonnull String detail, @Nullable Throwable cause) {
        super(ErrorKind.IO_FAILURE, detail, cause);
        this.uuid = Objects.requireNonNull(uuid, "uuid");
    }

    /**
     * Get the identity of the already-unregistered instance.
     *
     * @return instance uuid
     */
    @Nonnull
    public InstanceUuid getUuid() {
        return uuid;
    }
}
