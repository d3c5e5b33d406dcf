package me.internalizable.lodestone.daemon.auth;

import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Authenticated requester identity.
 *
 * <p>An immutable snapshot taken at authentication time, so permission checks
 * are pure lookups without locking or I/O.</p>
 */
public final class User {

    private final String uid;
    private final String username;
    private final boolean owner;
    private final boolean admin;
    private final UserPermission permissions;

    public User(@Nonnull String uid, @Nonnull String username, boolean owner, boolean admin,
                @Nonnull UserPermission permissions) {
        this.uid = Objects.requireNonNull(uid, "uid");
        this.username = Objects.requireNonNull(username, "username");
        this.owner = owner;
        this.admin = admin;
        this.permissions = Objects.requireNonNull(permissions, "permissions").copy();
    }

    /**
     * Check whether this user may perform an action.
     *
     * @param action requested action
     * @return true if allowed
     */
    public boolean canPerform(@Nonnull UserAction action) {
        Objects.requireNonNull(action, "action");
        if (owner) {
            return true;
        }
        if (admin) {
            return action.kind() != UserAction.Kind.MANAGE_PERMISSION;
        }
        return permissions.grants(action);
    }

    /**
     * Require that this user may perform an action.
     *
     * @param action requested action
     * @throws LodestoneException with {@link ErrorKind#FORBIDDEN} if not allowed
     */
    public void tryAction(@Nonnull UserAction action) {
        if (!canPerform(action)) {
            throw new LodestoneException(ErrorKind.FORBIDDEN,
                    "Not authorized to " + action.kind().getDescription());
        }
    }

    @Nonnull
    public String getUid() {
        return uid;
    }

    @Nonnull
    public String getUsername() {
        return username;
    }

    public boolean isOwner() {
        return owner;
    }

    public boolean isAdmin() {
        return admin;
    }

    /**
     * Get a copy of the permission record.
     *
     * @return permission copy
     */
    @Nonnull
    public UserPermission getPermissions() {
        return permissions.copy();
    }

    @Override
    public String toString() {
        return "User{" +
                "uid='" + uid + '\'' +
                ", username='" + username + '\'' +
                ", owner=" + owner +
                ", admin=" + admin +
                '}';
    }
}
