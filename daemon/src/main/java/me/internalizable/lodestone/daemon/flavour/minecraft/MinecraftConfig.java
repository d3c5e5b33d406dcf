package me.internalizable.lodestone.daemon.flavour.minecraft;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.util.Jsons;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Persistent settings of a Minecraft instance, kept next to the server files.
 */
public record MinecraftConfig(
        @JsonProperty("uuid") @Nonnull InstanceUuid uuid,
        @JsonProperty("name") @Nonnull String name,
        @JsonProperty("description") @Nullable String description,
        @JsonProperty("game_type") @Nonnull GameType gameType,
        @JsonProperty("version") @Nullable String version,
        @JsonProperty("port") int port,
        @JsonProperty("min_ram") int minRam,
        @JsonProperty("max_ram") int maxRam,
        @JsonProperty("cmd_args") @Nonnull List<String> cmdArgs,
        @JsonProperty("creation_time") long creationTime
) {

    public static final String FILE_NAME = ".lodestone_minecraft_config.json";

    public MinecraftConfig {
        cmdArgs = cmdArgs != null ? List.copyOf(cmdArgs) : List.of();
    }

    @Nonnull
    public static MinecraftConfig read(@Nonnull Path instanceDirectory) throws IOException {
        return Jsons.mapper().readValue(instanceDirectory.resolve(FILE_NAME).toFile(), MinecraftConfig.class);
    }

    public void write(@Nonnull Path instanceDirectory) throws IOException {
        Files.writeString(instanceDirectory.resolve(FILE_NAME), Jsons.toJson(this));
    }
}
