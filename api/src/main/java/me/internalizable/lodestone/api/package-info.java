/**
 * Public API for the Lodestone instance control plane.
 *
 * <p>Exposes the types shared between the daemon and its clients: instance
 * identities and snapshots, the abstract instance handle implemented by each
 * server flavour, file entries, and the error taxonomy.</p>
 *
 * @see me.internalizable.lodestone.api.LodestoneAPI
 */
package me.internalizable.lodestone.api;
