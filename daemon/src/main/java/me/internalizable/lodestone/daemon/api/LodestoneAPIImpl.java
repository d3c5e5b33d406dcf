package me.internalizable.lodestone.daemon.api;

import me.internalizable.lodestone.api.LodestoneAPI;
import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;
import me.internalizable.lodestone.api.fs.FileEntry;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceInfo;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.auth.IdentityProvider;
import me.internalizable.lodestone.daemon.auth.User;
import me.internalizable.lodestone.daemon.fs.InstanceFileService;
import me.internalizable.lodestone.daemon.instance.InstanceLifecycleManager;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Implementation of the LodestoneAPI: authenticate, then delegate.
 */
public class LodestoneAPIImpl implements LodestoneAPI {

    private final IdentityProvider identityProvider;
    private final InstanceLifecycleManager lifecycleManager;
    private final InstanceFileService fileService;

    public LodestoneAPIImpl(@Nonnull IdentityProvider identityProvider,
                            @Nonnull InstanceLifecycleManager lifecycleManager,
                            @Nonnull InstanceFileService fileService) {
        this.identityProvider = Objects.requireNonNull(identityProvider, "identityProvider");
        this.lifecycleManager = Objects.requireNonNull(lifecycleManager, "lifecycleManager");
        this.fileService = Objects.requireNonNull(fileService, "fileService");
    }

    @Override
    public void authenticate(@Nonnull String token) {
        requireUser(token);
    }

    private User requireUser(String token) {
        if (token == null || token.isEmpty()) {
            throw new LodestoneException(ErrorKind.UNAUTHORIZED, "Token error");
        }
        return identityProvider.authenticate(token)
                .orElseThrow(() -> new LodestoneException(ErrorKind.UNAUTHORIZED, "Token error"));
    }

    // ==================== Instances ====================

    @Override
    @Nonnull
    public List<InstanceInfo> listInstances(@Nonnull String token) {
        return lifecycleManager.listInstances(requireUser(token));
    }

    @Override
    @Nonnull
    public InstanceInfo getInstanceInfo(@Nonnull String token, @Nonnull InstanceUuid uuid) {
        Objects.requireNonNull(uuid, "uuid");
        return lifecycleManager.getInstanceInfo(requireUser(token), uuid);
    }

    @Override
    @Nonnull
    public InstanceUuid createInstance(@Nonnull String token, @Nonnull GameType gameType,
                                       @Nonnull Map<String, Object> manifest) {
        Objects.requireNonNull(gameType, "gameType");
        Objects.requireNonNull(manifest, "manifest");
        return lifecycleManager.createInstance(requireUser(token), gameType, manifest).uuid();
    }

    @Override
    public void deleteInstance(@Nonnull String token, @Nonnull InstanceUuid uuid) {
        Objects.requireNonNull(uuid, "uuid");
        lifecycleManager.deleteInstance(requireUser(token), uuid);
    }

    @Override
    public void startInstance(@Nonnull String token, @Nonnull InstanceUuid uuid) {
        Objects.requireNonNull(uuid, "uuid");
        lifecycleManager.startInstance(requireUser(token), uuid);
    }

    @Override
    public void stopInstance(@Nonnull String token, @Nonnull InstanceUuid uuid) {
        Objects.requireNonNull(uuid, "uuid");
        lifecycleManager.stopInstance(requireUser(token), uuid);
    }

    // ==================== Files ====================

    @Override
    @Nonnull
    public List<FileEntry> listInstanceFiles(@Nonnull String token, @Nonnull InstanceUuid uuid,
                                             @Nonnull String relativePath) {
        return fileService.listFiles(requireUser(token), uuid, relativePath);
    }

    @Override
    @Nonnull
    public String readInstanceFile(@Nonnull String token, @Nonnull InstanceUuid uuid, @Nonnull String relativePath) {
        return fileService.readFile(requireUser(token), uuid, relativePath);
    }

    @Override
    public void writeInstanceFile(@Nonnull String token, @Nonnull InstanceUuid uuid, @Nonnull String relativePath,
                                  @Nonnull byte[] content) {
        fileService.writeFile(requireUser(token), uuid, relativePath, content);
    }

    @Override
    public void makeInstanceDirectory(@Nonnull String token, @Nonnull InstanceUuid uuid,
                                      @Nonnull String relativePath) {
        fileService.makeDirectory(requireUser(token), uuid, relativePath);
    }

    @Override
    public void removeInstanceFile(@Nonnull String token, @Nonnull InstanceUuid uuid, @Nonnull String relativePath) {
        fileService.removeFile(requireUser(token), uuid, relativePath);
    }
}
