package me.internalizable.lodestone.api.instance;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Immutable snapshot of an instance, as returned by list and info lookups.
 *
 * @param uuid instance identity
 * @param name human-readable name
 * @param gameType server flavour
 * @param flavour flavour tag
 * @param description free-form description, may be null
 * @param port allocated network port
 * @param state lifecycle state at the time of the snapshot
 * @param creationTime creation timestamp in epoch milliseconds
 * @param path absolute path of the instance root
 */
public record InstanceInfo(
        @Nonnull InstanceUuid uuid,
        @Nonnull String name,
        @Nonnull @JsonProperty("game_type") GameType gameType,
        @Nonnull String flavour,
        @Nullable String description,
        int port,
        @Nonnull InstanceState state,
        @JsonProperty("creation_time") long creationTime,
        @Nonnull String path
) {}
