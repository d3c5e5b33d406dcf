package me.internalizable.lodestone.daemon.event;

import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceUuid;

/**
 * Payload attached to a progression start event.
 */
public interface ProgressionStartValue {

    /**
     * An instance is being created.
     */
    record InstanceCreation(InstanceUuid uuid, String name, int port, GameType gameType)
            implements ProgressionStartValue {
    }

    /**
     * An instance is being deleted.
     */
    record InstanceDelete(InstanceUuid uuid) implements ProgressionStartValue {
    }
}
