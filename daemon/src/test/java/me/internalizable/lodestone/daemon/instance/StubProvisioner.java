package me.internalizable.lodestone.daemon.instance;

import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceHandle;
import me.internalizable.lodestone.daemon.flavour.FlavourProvisioner;
import me.internalizable.lodestone.daemon.flavour.ProvisioningContext;
import me.internalizable.lodestone.daemon.flavour.SetupConfig;
import me.internalizable.lodestone.daemon.flavour.minecraft.MinecraftProvisioner;
import me.internalizable.lodestone.daemon.process.ProcessManager;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Provisioner that validates manifests like the Minecraft one but writes a
 * single properties file instead of a server layout. Provisioning can be held
 * on a gate or made to fail.
 */
public class StubProvisioner implements FlavourProvisioner {

    static final String STATE_FILE = "stub.properties";

    private final MinecraftProvisioner validator =
            new MinecraftProvisioner(new ProcessManager(Path.of("unused-logs"), "java"), 1);

    private volatile CountDownLatch gate;
    private volatile IOException failure;

    public void holdProvisioning(CountDownLatch gate) {
        this.gate = gate;
    }

    public void failProvisioning(IOException failure) {
        this.failure = failure;
    }

    @Override
    public Set<GameType> supportedGameTypes() {
        return EnumSet.of(GameType.MINECRAFT_JAVA_VANILLA);
    }

    @Override
    public SetupConfig buildSetupConfig(GameType gameType, Map<String, Object> manifest) {
        return validator.buildSetupConfig(gameType, manifest);
    }

    @Override
    public InstanceHandle provision(ProvisioningContext context) throws IOException {
        CountDownLatch currentGate = gate;
        if (currentGate != null) {
            try {
                if (!currentGate.await(10, TimeUnit.SECONDS)) {
                    throw new IOException("Gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted", e);
            }
        }
        context.reportProgress("Writing state", 5.0);
        if (failure != null) {
            throw failure;
        }

        SetupConfig setup = context.setupConfig();
        Properties props = new Properties();
        props.setProperty("name", setup.name());
        props.setProperty("port", String.valueOf(setup.port()));
        try (Writer writer = Files.newBufferedWriter(context.path().resolve(STATE_FILE))) {
            props.store(writer, null);
        }
        return new StubInstanceHandle(context.marker().uuid(), setup.name(), context.path(), setup.port());
    }

    @Override
    public InstanceHandle restore(Path path, DotLodestoneConfig marker) throws IOException {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(path.resolve(STATE_FILE))) {
            props.load(reader);
        }
        return new StubInstanceHandle(marker.uuid(), props.getProperty("name"), path,
                Integer.parseInt(props.getProperty("port")));
    }
}
