package me.internalizable.lodestone.daemon.flavour;

import me.internalizable.lodestone.api.instance.GameType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Validated settings for a new instance, derived from a user manifest.
 *
 * @param gameType server flavour
 * @param name instance name, safe to use as a directory name component
 * @param description free-form description
 * @param port network port
 * @param version game version, null for the flavour default
 * @param minRam minimum heap in megabytes
 * @param maxRam maximum heap in megabytes
 * @param cmdArgs extra JVM arguments
 */
public record SetupConfig(
        @Nonnull GameType gameType,
        @Nonnull String name,
        @Nullable String description,
        int port,
        @Nullable String version,
        int minRam,
        int maxRam,
        @Nonnull List<String> cmdArgs
) {

    public SetupConfig {
        Objects.requireNonNull(gameType, "gameType");
        Objects.requireNonNull(name, "name");
        cmdArgs = List.copyOf(cmdArgs);
    }

    @Nonnull
    public String flavour() {
        return gameType.getFlavour();
    }
}
