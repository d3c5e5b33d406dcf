package me.internalizable.lodestone.daemon.auth;

import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.event.CausedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Users and their permission records, persisted to {@code users.yml}.
 *
 * <p>One lock guards the in-memory table. Persistence writes a snapshot taken
 * under the lock, after the lock is released.</p>
 */
public class UserStore implements IdentityProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(UserStore.class);
    private static final int TOKEN_BYTES = 32;

    private final Path usersFile;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, UsersFile.UserEntry> users = new LinkedHashMap<>();
    private final ReentrantLock saveLock = new ReentrantLock();

    public UserStore(@Nonnull Path usersFile) {
        this.usersFile = Objects.requireNonNull(usersFile, "usersFile");
    }

    // ==================== Persistence ====================

    /**
     * Load users from disk, generating an owner account if the file is absent.
     *
     * @throws IOException if the file cannot be read or the default cannot be written
     */
    public void load() throws IOException {
        if (!Files.exists(usersFile)) {
            String token = generateToken();
            UsersFile.UserEntry owner = new UsersFile.UserEntry(UUID.randomUUID().toString(), "owner", token,
                    true, false, new UserPermission());
            lock.lock();
            try {
                users.clear();
                users.put(owner.getUid(), owner);
            } finally {
                lock.unlock();
            }
            save();
            LOGGER.warn("No users file found, created owner account. Owner token: {}", token);
            return;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(UsersFile.class, options));
        UsersFile file;
        try (InputStream is = Files.newInputStream(usersFile)) {
            file = yaml.load(is);
        }

        lock.lock();
        try {
            users.clear();
            if (file != null) {
                for (UsersFile.UserEntry entry : file.getUsers()) {
                    if (entry.getUid() == null || entry.getToken() == null) {
                        LOGGER.warn("Skipping user entry without uid or token in {}", usersFile);
                        continue;
                    }
                    if (entry.getUsername() == null) {
                        entry.setUsername(entry.getUid());
                    }
                    users.put(entry.getUid(), entry);
                }
            }
        } finally {
            lock.unlock();
        }
        LOGGER.info("Loaded {} user(s) from {}", getUserCount(), usersFile);
    }

    /**
     * Write the current user table to disk.
     *
     * @throws IOException if writing fails
     */
    public void save() throws IOException {
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(dumperOptions);

        // Snapshot and write under one lock so an older snapshot never lands after a newer one
        saveLock.lock();
        try {
            UsersFile file = new UsersFile();
            lock.lock();
            try {
                List<UsersFile.UserEntry> snapshot = new ArrayList<>();
                for (UsersFile.UserEntry entry : users.values()) {
                    snapshot.add(entry.copy());
                }
                file.setUsers(snapshot);
            } finally {
                lock.unlock();
            }

            String content = yaml.dumpAs(file, Tag.MAP, DumperOptions.FlowStyle.BLOCK);
            Path parent = usersFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(usersFile, content, StandardCharsets.UTF_8);
        } finally {
            saveLock.unlock();
        }
    }

    // ==================== Authentication ====================

    @Nonnull
    @Override
    public Optional<User> authenticate(@Nonnull String token) {
        Objects.requireNonNull(token, "token");
        byte[] presented = token.getBytes(StandardCharsets.UTF_8);
        lock.lock();
        try {
            for (UsersFile.UserEntry entry : users.values()) {
                if (MessageDigest.isEqual(presented, entry.getToken().getBytes(StandardCharsets.UTF_8))) {
                    return Optional.of(entry.toUser());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    // ==================== User Management ====================

    /**
     * Add a user and persist.
     *
     * @param username display name
     * @param token bearer token
     * @param owner owner flag
     * @param admin admin flag
     * @param permissions initial permissions
     * @return the created user
     * @throws IOException if persisting fails
     */
    @Nonnull
    public User addUser(@Nonnull String username, @Nonnull String token, boolean owner, boolean admin,
                        @Nonnull UserPermission permissions) throws IOException {
        UsersFile.UserEntry entry = new UsersFile.UserEntry(UUID.randomUUID().toString(),
                Objects.requireNonNull(username, "username"), Objects.requireNonNull(token, "token"),
                owner, admin, permissions.copy());
        User user;
        lock.lock();
        try {
            users.put(entry.getUid(), entry);
            user = entry.toUser();
        } finally {
            lock.unlock();
        }
        save();
        LOGGER.info("Added user {} ({})", username, entry.getUid());
        return user;
    }

    /**
     * Look up a user by id.
     *
     * @param uid user id
     * @return the user, or empty
     */
    @Nonnull
    public Optional<User> getUser(@Nonnull String uid) {
        lock.lock();
        try {
            UsersFile.UserEntry entry = users.get(uid);
            return entry != null ? Optional.of(entry.toUser()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int getUserCount() {
        lock.lock();
        try {
            return users.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Grant a user full access to an instance and persist.
     *
     * <p>Applied to the current record, so concurrent grants do not overwrite
     * each other.</p>
     *
     * @param uid user id
     * @param uuid instance identity
     * @param causedBy who triggered the grant
     * @return false if the user does not exist
     * @throws IOException if persisting fails
     */
    public boolean grantInstanceOwnership(@Nonnull String uid, @Nonnull InstanceUuid uuid,
                                          @Nonnull CausedBy causedBy) throws IOException {
        boolean updated = modify(uid, entry -> entry.getPermissions().grantInstanceOwnership(uuid));
        if (updated) {
            LOGGER.debug("Granted user {} access to instance {} ({})", uid, uuid, causedBy);
        }
        return updated;
    }

    private boolean modify(String uid, Consumer<UsersFile.UserEntry> change) throws IOException {
        lock.lock();
        try {
            UsersFile.UserEntry entry = users.get(uid);
            if (entry == null) {
                return false;
            }
            change.accept(entry);
        } finally {
            lock.unlock();
        }
        save();
        return true;
    }

    private static String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        new SecureRandom().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
