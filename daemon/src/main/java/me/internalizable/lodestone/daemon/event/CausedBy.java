package me.internalizable.lodestone.daemon.event;

import me.internalizable.lodestone.daemon.auth.User;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Who triggered an event: a user, or the daemon itself.
 *
 * @param userId user id, null for system
 * @param userName user name, null for system
 */
public record CausedBy(@Nullable String userId, @Nullable String userName) {

    private static final CausedBy SYSTEM = new CausedBy(null, null);

    @Nonnull
    public static CausedBy user(@Nonnull User user) {
        Objects.requireNonNull(user, "user");
        return new CausedBy(user.getUid(), user.getUsername());
    }

    @Nonnull
    public static CausedBy system() {
        return SYSTEM;
    }

    public boolean isSystem() {
        return userId == null;
    }

    @Override
    public String toString() {
        return isSystem() ? "system" : userName + " (" + userId + ")";
    }
}
