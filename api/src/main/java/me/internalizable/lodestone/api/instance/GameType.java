package me.internalizable.lodestone.api.instance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Supported server flavours.
 *
 * <p>The orchestrator treats these opaquely; each one is served by a
 * flavour provisioner registered in the daemon.</p>
 */
public enum GameType {
    MINECRAFT_JAVA_VANILLA("minecraft", "vanilla"),
    MINECRAFT_FORGE("minecraft", "forge"),
    MINECRAFT_FABRIC("minecraft", "fabric"),
    MINECRAFT_PAPER("minecraft", "paper");

    private final String game;
    private final String flavour;

    GameType(String game, String flavour) {
        this.game = game;
        this.flavour = flavour;
    }

    /**
     * Get the game family, e.g. {@code minecraft}.
     *
     * @return game name
     */
    @Nonnull
    public String getGame() {
        return game;
    }

    /**
     * Get the flavour tag, e.g. {@code vanilla}.
     *
     * @return flavour name
     */
    @Nonnull
    public String getFlavour() {
        return flavour;
    }

    /**
     * Get the wire identifier, e.g. {@code minecraft_java_vanilla}.
     *
     * @return identifier
     */
    @Nonnull
    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a game type leniently.
     *
     * <p>Accepts {@code minecraft_java_vanilla}, {@code MinecraftJavaVanilla}
     * and {@code minecraft-java-vanilla} alike.</p>
     *
     * @param value raw value
     * @return the game type
     * @throws IllegalArgumentException if nothing matches
     */
    @Nonnull
    @JsonCreator
    public static GameType fromString(@Nonnull String value) {
        Objects.requireNonNull(value, "value");
        String wanted = normalize(value);
        for (GameType type : values()) {
            if (normalize(type.name()).equals(wanted)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown game type: " + value);
    }

    private static String normalize(String value) {
        return value.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
