package me.internalizable.lodestone.daemon.auth;

import me.internalizable.lodestone.api.instance.InstanceUuid;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-user permission record.
 *
 * <p>Global capabilities are booleans; instance capabilities are sets of
 * instance uuids. Persisted as part of {@code users.yml}.</p>
 */
public class UserPermission {

    private boolean canCreateInstance;
    private boolean canDeleteInstance;
    private boolean canManagePermission;
    private Set<String> canViewInstance = new HashSet<>();
    private Set<String> canStartInstance = new HashSet<>();
    private Set<String> canStopInstance = new HashSet<>();
    private Set<String> canReadInstanceFile = new HashSet<>();
    private Set<String> canWriteInstanceFile = new HashSet<>();

    /**
     * Check whether this record grants an action. Owner and admin overrides are
     * applied by {@link User}, not here.
     *
     * @param action requested action
     * @return true if granted
     */
    public boolean grants(@Nonnull UserAction action) {
        String uuid = action.instance() != null ? action.instance().value() : null;
        return switch (action.kind()) {
            case VIEW_INSTANCE -> canViewInstance.contains(uuid);
            case START_INSTANCE -> canStartInstance.contains(uuid);
            case STOP_INSTANCE -> canStopInstance.contains(uuid);
            case READ_INSTANCE_FILE -> canReadInstanceFile.contains(uuid);
            case WRITE_INSTANCE_FILE -> canWriteInstanceFile.contains(uuid);
            case CREATE_INSTANCE -> canCreateInstance;
            case DELETE_INSTANCE -> canDeleteInstance;
            case MANAGE_PERMISSION -> canManagePermission;
        };
    }

    /**
     * Grant everything a creator gets on a new instance: start, stop, view,
     * read files and write files.
     *
     * @param uuid instance identity
     */
    public void grantInstanceOwnership(@Nonnull InstanceUuid uuid) {
        String value = uuid.value();
        canStartInstance.add(value);
        canStopInstance.add(value);
        canViewInstance.add(value);
        canReadInstanceFile.add(value);
        canWriteInstanceFile.add(value);
    }

    /**
     * Deep copy.
     *
     * @return independent copy of this record
     */
    @Nonnull
    public UserPermission copy() {
        UserPermission copy = new UserPermission();
        copy.canCreateInstance = canCreateInstance;
        copy.canDeleteInstance = canDeleteInstance;
        copy.canManagePermission = canManagePermission;
        copy.canViewInstance = new HashSet<>(canViewInstance);
        copy.canStartInstance = new HashSet<>(canStartInstance);
        copy.canStopInstance = new HashSet<>(canStopInstance);
        copy.canReadInstanceFile = new HashSet<>(canReadInstanceFile);
        copy.canWriteInstanceFile = new HashSet<>(canWriteInstanceFile);
        return copy;
    }

    // Getters and Setters

    public boolean isCanCreateInstance() {
        return canCreateInstance;
    }

    public void setCanCreateInstance(boolean canCreateInstance) {
        this.canCreateInstance = canCreateInstance;
    }

    public boolean isCanDeleteInstance() {
        return canDeleteInstance;
    }

    public void setCanDeleteInstance(boolean canDeleteInstance) {
        this.canDeleteInstance = canDeleteInstance;
    }

    public boolean isCanManagePermission() {
        return canManagePermission;
    }

    public void setCanManagePermission(boolean canManagePermission) {
        this.canManagePermission = canManagePermission;
    }

    public Set<String> getCanViewInstance() {
        return canViewInstance;
    }

    public void setCanViewInstance(Set<String> canViewInstance) {
        this.canViewInstance = canViewInstance != null ? canViewInstance : new HashSet<>();
    }

    public Set<String> getCanStartInstance() {
        return canStartInstance;
    }

    public void setCanStartInstance(Set<String> canStartInstance) {
        this.canStartInstance = canStartInstance != null ? canStartInstance : new HashSet<>();
    }

    public Set<String> getCanStopInstance() {
        return canStopInstance;
    }

    public void setCanStopInstance(Set<String> canStopInstance) {
        this.canStopInstance = canStopInstance != null ? canStopInstance : new HashSet<>();
    }

    public Set<String> getCanReadInstanceFile() {
        return canReadInstanceFile;
    }

    public void setCanReadInstanceFile(Set<String> canReadInstanceFile) {
        this.canReadInstanceFile = canReadInstanceFile != null ? canReadInstanceFile : new HashSet<>();
    }

    public Set<String> getCanWriteInstanceFile() {
        return canWriteInstanceFile;
    }

    public void setCanWriteInstanceFile(Set<String> canWriteInstanceFile) {
        this.canWriteInstanceFile = canWriteInstanceFile != null ? canWriteInstanceFile : new HashSet<>();
    }
}
