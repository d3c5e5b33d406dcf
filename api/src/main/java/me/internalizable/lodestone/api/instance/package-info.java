/**
 * Instance identity, state and the handle abstraction implemented by server flavours.
 *
 * @see me.internalizable.lodestone.api.instance.InstanceHandle
 */
package me.internalizable.lodestone.api.instance;
