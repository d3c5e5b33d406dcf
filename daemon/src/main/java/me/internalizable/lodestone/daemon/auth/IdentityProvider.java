package me.internalizable.lodestone.daemon.auth;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Turns a bearer token into a requester identity.
 */
@FunctionalInterface
public interface IdentityProvider {

    /**
     * Authenticate a token.
     *
     * @param token bearer token
     * @return the requester, or empty if the token is unknown
     */
    @Nonnull
    Optional<User> authenticate(@Nonnull String token);
}
