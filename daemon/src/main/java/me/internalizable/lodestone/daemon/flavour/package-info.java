/**
 * Game flavours: turning a manifest into a provisioned instance.
 *
 * @see me.internalizable.lodestone.daemon.flavour.FlavourProvisioner
 */
package me.internalizable.lodestone.daemon.flavour;
