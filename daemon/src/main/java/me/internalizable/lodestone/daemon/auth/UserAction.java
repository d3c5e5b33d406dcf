package me.internalizable.lodestone.daemon.auth;

import me.internalizable.lodestone.api.instance.InstanceUuid;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * An action a requester wants to perform, scoped to an instance where relevant.
 *
 * @param kind action kind
 * @param instance target instance, null for instance-independent actions
 */
public record UserAction(@Nonnull Kind kind, @Nullable InstanceUuid instance) {

    public UserAction {
        Objects.requireNonNull(kind, "kind");
        if (kind.isInstanceScoped() && instance == null) {
            throw new IllegalArgumentException(kind + " requires an instance");
        }
    }

    public static UserAction viewInstance(@Nonnull InstanceUuid uuid) {
        return new UserAction(Kind.VIEW_INSTANCE, uuid);
    }

    public static UserAction startInstance(@Nonnull InstanceUuid uuid) {
        return new UserAction(Kind.START_INSTANCE, uuid);
    }

    public static UserAction stopInstance(@Nonnull InstanceUuid uuid) {
        return new UserAction(Kind.STOP_INSTANCE, uuid);
    }

    public static UserAction readInstanceFile(@Nonnull InstanceUuid uuid) {
        return new UserAction(Kind.READ_INSTANCE_FILE, uuid);
    }

    public static UserAction writeInstanceFile(@Nonnull InstanceUuid uuid) {
        return new UserAction(Kind.WRITE_INSTANCE_FILE, uuid);
    }

    public static UserAction createInstance() {
        return new UserAction(Kind.CREATE_INSTANCE, null);
    }

    public static UserAction deleteInstance() {
        return new UserAction(Kind.DELETE_INSTANCE, null);
    }

    public static UserAction managePermission() {
        return new UserAction(Kind.MANAGE_PERMISSION, null);
    }

    /**
     * Action kinds.
     */
    public enum Kind {
        VIEW_INSTANCE(true, "view instance"),
        START_INSTANCE(true, "start instance"),
        STOP_INSTANCE(true, "stop instance"),
        READ_INSTANCE_FILE(true, "access instance files"),
        WRITE_INSTANCE_FILE(true, "modify instance files"),
        CREATE_INSTANCE(false, "create instances"),
        DELETE_INSTANCE(false, "delete instances"),
        MANAGE_PERMISSION(false, "manage permissions");

        private final boolean instanceScoped;
        private final String description;

        Kind(boolean instanceScoped, String description) {
            this.instanceScoped = instanceScoped;
            this.description = description;
        }

        public boolean isInstanceScoped() {
            return instanceScoped;
        }

        @Nonnull
        public String getDescription() {
            return description;
        }
    }
}
