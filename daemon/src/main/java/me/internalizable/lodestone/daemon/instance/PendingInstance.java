package me.internalizable.lodestone.daemon.instance;

import me.internalizable.lodestone.api.instance.InstanceUuid;

import java.util.concurrent.CompletableFuture;

/**
 * An accepted creation whose provisioning is still running.
 *
 * <p>The future completes once the instance is registered, or exceptionally
 * when provisioning failed and rollback could not clean up.</p>
 *
 * @param uuid identity of the instance being created
 * @param provisioning background provisioning task
 */
public record PendingInstance(InstanceUuid uuid, CompletableFuture<Void> provisioning) {
}
