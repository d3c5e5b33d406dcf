package me.internalizable.lodestone.daemon.flavour.minecraft;

import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceHandle;
import me.internalizable.lodestone.daemon.flavour.FlavourProvisioner;
import me.internalizable.lodestone.daemon.flavour.ProvisioningContext;
import me.internalizable.lodestone.daemon.flavour.SetupConfig;
import me.internalizable.lodestone.daemon.instance.DotLodestoneConfig;
import me.internalizable.lodestone.daemon.process.ProcessManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Provisions Minecraft Java servers of every supported flavour.
 *
 * <p>The server jar itself is supplied by the operator as {@code server.jar}
 * in the instance directory.</p>
 */
public class MinecraftProvisioner implements FlavourProvisioner {

    private static final Logger LOGGER = LoggerFactory.getLogger(MinecraftProvisioner.class);

    static final String SERVER_PROPERTIES_FILE = "server.properties";
    static final String EULA_FILE = "eula.txt";

    private static final int DEFAULT_MIN_RAM = 1024;
    private static final int DEFAULT_MAX_RAM = 2048;
    private static final int MAX_NAME_LENGTH = 100;

    private final ProcessManager processManager;
    private final int gracefulStopTimeoutSeconds;

    public MinecraftProvisioner(@Nonnull ProcessManager processManager, int gracefulStopTimeoutSeconds) {
        this.processManager = Objects.requireNonNull(processManager, "processManager");
        this.gracefulStopTimeoutSeconds = gracefulStopTimeoutSeconds;
    }

    @Nonnull
    @Override
    public Set<GameType> supportedGameTypes() {
        return EnumSet.of(GameType.MINECRAFT_JAVA_VANILLA, GameType.MINECRAFT_FORGE,
                GameType.MINECRAFT_FABRIC, GameType.MINECRAFT_PAPER);
    }

    // ==================== Manifest ====================

    @Nonnull
    @Override
    public SetupConfig buildSetupConfig(@Nonnull GameType gameType, @Nonnull Map<String, Object> manifest) {
        Objects.requireNonNull(manifest, "manifest");

        String name = requireName(manifest.get("name"));
        int port = requirePort(manifest.get("port"));
        String description = optionalString(manifest, "description");
        String version = optionalString(manifest, "version");
        int minRam = optionalInt(manifest, "min_ram", DEFAULT_MIN_RAM);
        int maxRam = optionalInt(manifest, "max_ram", Math.max(DEFAULT_MAX_RAM, minRam));
        if (minRam <= 0 || maxRam <= 0) {
            throw LodestoneException.badRequest("min_ram and max_ram must be positive");
        }
        if (minRam > maxRam) {
            throw LodestoneException.badRequest("min_ram must not exceed max_ram");
        }

        return new SetupConfig(gameType, name, description, port, version, minRam, maxRam, cmdArgs(manifest.get("cmd_args")));
    }

    private static String requireName(Object value) {
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw LodestoneException.badRequest("Manifest field 'name' is required");
        }
        String name = ((String) value).trim();
        if (name.length() > MAX_NAME_LENGTH) {
            throw LodestoneException.badRequest("Instance name is too long");
        }
        if (name.contains("/") || name.contains("\\") || name.contains("..")
                || name.indexOf('\0') >= 0 || name.indexOf(':') >= 0) {
            throw LodestoneException.badRequest("Instance name contains illegal characters");
        }
        return name;
    }

    private static int requirePort(Object value) {
        if (value == null) {
            throw LodestoneException.badRequest("Manifest field 'port' is required");
        }
        int port = toInt(value, "port");
        if (port < 1 || port > 65535) {
            throw LodestoneException.badRequest("Port must be between 1 and 65535");
        }
        return port;
    }

    @Nullable
    private static String optionalString(Map<String, Object> manifest, String key) {
        Object value = manifest.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw LodestoneException.badRequest("Manifest field '" + key + "' must be a string");
        }
        return (String) value;
    }

    private static int optionalInt(Map<String, Object> manifest, String key, int defaultValue) {
        Object value = manifest.get(key);
        return value != null ? toInt(value, key) : defaultValue;
    }

    private static int toInt(Object value, String key) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long number = ((Number) value).longValue();
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        } else if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new LodestoneException(ErrorKind.BAD_REQUEST,
                        "Manifest field '" + key + "' must be an integer", e);
            }
        }
        throw LodestoneException.badRequest("Manifest field '" + key + "' must be an integer");
    }

    private static List<String> cmdArgs(Object value) {
        List<String> args = new ArrayList<>();
        if (value == null) {
            return args;
        }
        if (value instanceof String) {
            for (String arg : ((String) value).trim().split("\\s+")) {
                if (!arg.isEmpty()) {
                    args.add(arg);
                }
            }
            return args;
        }
        if (value instanceof List) {
            for (Object arg : (List<?>) value) {
                if (!(arg instanceof String)) {
                    throw LodestoneException.badRequest("Manifest field 'cmd_args' must contain strings");
                }
                args.add((String) arg);
            }
            return args;
        }
        throw LodestoneException.badRequest("Manifest field 'cmd_args' must be a list of strings");
    }

    // ==================== Provisioning ====================

    @Nonnull
    @Override
    public InstanceHandle provision(@Nonnull ProvisioningContext context) throws IOException {
        SetupConfig setup = context.setupConfig();
        Path path = context.path();

        context.reportProgress("Writing " + SERVER_PROPERTIES_FILE, 1.0);
        writeServerProperties(path, setup);

        context.reportProgress("Accepting EULA", 1.0);
        Files.writeString(path.resolve(EULA_FILE), "eula=true\n", StandardCharsets.UTF_8);

        context.reportProgress("Saving instance settings", 1.0);
        MinecraftConfig config = new MinecraftConfig(context.marker().uuid(), setup.name(), setup.description(),
                setup.gameType(), setup.version(), setup.port(), setup.minRam(), setup.maxRam(),
                setup.cmdArgs(), System.currentTimeMillis());
        config.write(path);

        LOGGER.info("Provisioned {} server '{}' in {}", setup.gameType().getId(), setup.name(), path);
        return new MinecraftInstance(config, path, processManager, gracefulStopTimeoutSeconds);
    }

    private static void writeServerProperties(Path path, SetupConfig setup) throws IOException {
        Properties props = new Properties();
        Path propsPath = path.resolve(SERVER_PROPERTIES_FILE);
        if (Files.exists(propsPath)) {
            try (var reader = Files.newBufferedReader(propsPath, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        }
        props.setProperty("server-port", String.valueOf(setup.port()));
        if (setup.description() != null) {
            props.setProperty("motd", setup.description());
        }
        try (Writer writer = Files.newBufferedWriter(propsPath, StandardCharsets.UTF_8)) {
            props.store(writer, "Generated by Lodestone");
        }
    }

    // ==================== Restore ====================

    @Nonnull
    @Override
    public InstanceHandle restore(@Nonnull Path path, @Nonnull DotLodestoneConfig marker) throws IOException {
        MinecraftConfig config = MinecraftConfig.read(path);
        if (!config.uuid().equals(marker.uuid())) {
            throw new IOException("Identity in " + MinecraftConfig.FILE_NAME + " does not match "
                    + DotLodestoneConfig.FILE_NAME);
        }
        return new MinecraftInstance(config, path, processManager, gracefulStopTimeoutSeconds);
    }
}
