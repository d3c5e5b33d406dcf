/**
 * Instance registry and lifecycle orchestration.
 *
 * <p>This package handles creating, deleting, starting and stopping
 * instances, and restoring them from disk on daemon start.</p>
 *
 * @see me.internalizable.lodestone.daemon.instance.InstanceLifecycleManager
 * @see me.internalizable.lodestone.daemon.instance.InstanceRegistry
 */
package me.internalizable.lodestone.daemon.instance;
