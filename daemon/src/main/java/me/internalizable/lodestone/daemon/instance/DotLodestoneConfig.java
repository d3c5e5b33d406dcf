package me.internalizable.lodestone.daemon.instance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.util.Jsons;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Marker file identifying a directory as an instance root.
 *
 * <p>Stored as JSON in {@value #FILE_NAME}. Its presence is what makes an
 * instance recoverable after a daemon restart.</p>
 *
 * @param uuid instance identity
 * @param gameType server flavour
 */
public record DotLodestoneConfig(
        @JsonProperty("uuid") @Nonnull InstanceUuid uuid,
        @JsonProperty("game_type") @Nonnull GameType gameType
) {

    public static final String FILE_NAME = ".lodestone_config";

    @JsonCreator
    public DotLodestoneConfig {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(gameType, "gameType");
    }

    /**
     * Read the marker of an instance directory.
     *
     * @param instanceDirectory instance root
     * @return the marker
     * @throws IOException if missing or unreadable
     */
    @Nonnull
    public static DotLodestoneConfig read(@Nonnull Path instanceDirectory) throws IOException {
        return Jsons.mapper().readValue(instanceDirectory.resolve(FILE_NAME).toFile(), DotLodestoneConfig.class);
    }

    /**
     * Write this marker into an instance directory, replacing any existing one.
     *
     * @param instanceDirectory instance root
     * @throws IOException if writing fails
     */
    public void write(@Nonnull Path instanceDirectory) throws IOException {
        Files.writeString(instanceDirectory.resolve(FILE_NAME), Jsons.toJson(this));
    }
}
