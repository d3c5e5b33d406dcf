package me.internalizable.lodestone.daemon.event;

import me.internalizable.lodestone.api.instance.InstanceInfo;
import me.internalizable.lodestone.api.instance.InstanceUuid;

/**
 * Payload attached to a successful progression end event.
 */
public interface ProgressionEndValue {

    /**
     * The instance was created and registered.
     */
    record InstanceCreation(InstanceInfo info) implements ProgressionEndValue {
    }

    /**
     * The instance was deleted.
     */
    record InstanceDelete(InstanceUuid uuid) implements ProgressionEndValue {
    }
}
