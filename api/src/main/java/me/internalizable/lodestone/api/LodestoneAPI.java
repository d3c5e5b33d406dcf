package me.internalizable.lodestone.api;

import me.internalizable.lodestone.api.fs.FileEntry;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceInfo;
import me.internalizable.lodestone.api.instance.InstanceUuid;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * API for managing game server instances.
 *
 * <p>Every call authenticates the bearer token first and then checks the
 * requester's permissions for the specific action and instance. Failures are
 * reported as {@link me.internalizable.lodestone.api.error.LodestoneException}
 * carrying an {@link me.internalizable.lodestone.api.error.ErrorKind}.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * LodestoneAPI api = daemon.getApi();
 *
 * InstanceUuid uuid = api.createInstance(token, GameType.MINECRAFT_JAVA_VANILLA,
 *     Map.of("name", "survival", "port", 25565));
 *
 * // Provisioning runs in the background; the instance shows up once registered
 * InstanceInfo info = api.getInstanceInfo(token, uuid);
 * }</pre>
 */
public interface LodestoneAPI {

    /**
     * Check a bearer token without performing any action.
     *
     * @param token bearer token
     * @throws me.internalizable.lodestone.api.error.LodestoneException with kind UNAUTHORIZED
     *         if the token is empty or unknown
     */
    void authenticate(@Nonnull String token);

    /**
     * List the instances the requester may view, oldest first.
     *
     * @param token bearer token
     * @return visible instances sorted by creation time
     */
    @Nonnull
    List<InstanceInfo> listInstances(@Nonnull String token);

    /**
     * Get information about an instance.
     *
     * @param token bearer token
     * @param uuid instance identity
     * @return instance info
     */
    @Nonnull
    InstanceInfo getInstanceInfo(@Nonnull String token, @Nonnull InstanceUuid uuid);

    /**
     * Create an instance.
     *
     * <p>Returns as soon as the instance directory and its marker exist;
     * provisioning continues in the background and reports through
     * progression events.</p>
     *
     * @param token bearer token
     * @param gameType server flavour
     * @param manifest user-supplied settings
     * @return identity of the new instance
     */
    @Nonnull
    InstanceUuid createInstance(@Nonnull String token, @Nonnull GameType gameType, @Nonnull Map<String, Object> manifest);

    /**
     * Delete a stopped instance and its files.
     *
     * @param token bearer token
     * @param uuid instance identity
     */
    void deleteInstance(@Nonnull String token, @Nonnull InstanceUuid uuid);

    /**
     * Start an instance.
     *
     * @param token bearer token
     * @param uuid instance identity
     */
    void startInstance(@Nonnull String token, @Nonnull InstanceUuid uuid);

    /**
     * Stop an instance and wait for its process to exit.
     *
     * @param token bearer token
     * @param uuid instance identity
     */
    void stopInstance(@Nonnull String token, @Nonnull InstanceUuid uuid);

    /**
     * List a directory inside an instance.
     *
     * @param token bearer token
     * @param uuid instance identity
     * @param relativePath directory path relative to the instance root
     * @return directory entries
     */
    @Nonnull
    List<FileEntry> listInstanceFiles(@Nonnull String token, @Nonnull InstanceUuid uuid, @Nonnull String relativePath);

    /**
     * Read a UTF-8 text file inside an instance.
     *
     * @param token bearer token
     * @param uuid instance identity
     * @param relativePath file path relative to the instance root
     * @return file content
     */
    @Nonnull
    String readInstanceFile(@Nonnull String token, @Nonnull InstanceUuid uuid, @Nonnull String relativePath);

    /**
     * Create or overwrite a file inside an instance.
     *
     * @param token bearer token
     * @param uuid instance identity
     * @param relativePath file path relative to the instance root
     * @param content raw content
     */
    void writeInstanceFile(@Nonnull String token, @Nonnull InstanceUuid uuid, @Nonnull String relativePath, @Nonnull byte[] content);

    /**
     * Create a directory (and missing parents) inside an instance.
     *
     * @param token bearer token
     * @param uuid instance identity
     * @param relativePath directory path relative to the instance root
     */
    void makeInstanceDirectory(@Nonnull String token, @Nonnull InstanceUuid uuid, @Nonnull String relativePath);

    /**
     * Remove a file or directory tree inside an instance.
     *
     * @param token bearer token
     * @param uuid instance identity
     * @param relativePath path relative to the instance root
     */
    void removeInstanceFile(@Nonnull String token, @Nonnull InstanceUuid uuid, @Nonnull String relativePath);
}
