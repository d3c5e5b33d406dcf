/**
 * Lodestone daemon: manages game server instances on one host.
 *
 * <p>{@link me.internalizable.lodestone.daemon.LodestoneDaemon} wires the
 * components; requests flow from the HTTP server through
 * {@link me.internalizable.lodestone.daemon.api.LodestoneAPIImpl} into the
 * lifecycle manager and the instance file service.</p>
 */
package me.internalizable.lodestone.daemon;
