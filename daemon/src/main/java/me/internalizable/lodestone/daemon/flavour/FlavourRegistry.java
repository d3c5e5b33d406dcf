package me.internalizable.lodestone.daemon.flavour;

import me.internalizable.lodestone.api.instance.GameType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps game types to their provisioners.
 */
public class FlavourRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlavourRegistry.class);

    private final Map<GameType, FlavourProvisioner> provisioners = new EnumMap<>(GameType.class);

    /**
     * Register a provisioner for every game type it supports.
     *
     * @param provisioner the provisioner
     * @throws IllegalStateException if a game type already has a provisioner
     */
    public synchronized void register(@Nonnull FlavourProvisioner provisioner) {
        Objects.requireNonNull(provisioner, "provisioner");
        for (GameType gameType : provisioner.supportedGameTypes()) {
            if (provisioners.containsKey(gameType)) {
                throw new IllegalStateException("Provisioner already registered for " + gameType.getId());
            }
        }
        for (GameType gameType : provisioner.supportedGameTypes()) {
            provisioners.put(gameType, provisioner);
            LOGGER.debug("Registered provisioner {} for {}", provisioner.getClass().getSimpleName(), gameType.getId());
        }
    }

    @Nonnull
    public synchronized Optional<FlavourProvisioner> get(@Nonnull GameType gameType) {
        return Optional.ofNullable(provisioners.get(gameType));
    }

    @Nonnull
    public synchronized Set<GameType> getSupportedGameTypes() {
        return Set.copyOf(provisioners.keySet());
    }
}
