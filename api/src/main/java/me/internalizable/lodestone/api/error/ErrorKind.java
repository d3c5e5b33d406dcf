package me.internalizable.lodestone.api.error;

/**
 * Machine-readable failure kinds surfaced to callers.
 */
public enum ErrorKind {
    /**
     * Missing or invalid bearer token.
     */
    UNAUTHORIZED,

    /**
     * Authenticated, but not permitted to perform the action.
     */
    FORBIDDEN,

    /**
     * Instance, file or directory does not exist.
     */
    NOT_FOUND,

    /**
     * A precondition was violated, e.g. deleting a running instance.
     */
    BAD_REQUEST,

    /**
     * Path escapes its sandbox or cannot be parsed.
     */
    MALFORMED_PATH,

    /**
     * Write or delete of a protected file type.
     */
    PROTECTED_RESOURCE,

    /**
     * Underlying filesystem or process failure.
     */
    IO_FAILURE
}
