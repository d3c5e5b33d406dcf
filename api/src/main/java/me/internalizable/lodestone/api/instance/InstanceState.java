package me.internalizable.lodestone.api.instance;

/**
 * Lifecycle state of a managed instance.
 *
 * <pre>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED
 *               ↓          ↓
 *             ERROR      ERROR
 * </pre>
 */
public enum InstanceState {
    /**
     * Server process is starting up.
     */
    STARTING,

    /**
     * Server is running and accepting connections.
     */
    RUNNING,

    /**
     * Server is shutting down.
     */
    STOPPING,

    /**
     * No server process is running. The only state in which deletion is accepted.
     */
    STOPPED,

    /**
     * Server process exited unexpectedly or failed to start.
     */
    ERROR;

    /**
     * Check if the instance may be deleted in this state.
     *
     * @return true if stopped
     */
    public boolean isDeletable() {
        return this == STOPPED;
    }

    /**
     * Check if a server process is expected to be alive.
     *
     * @return true while starting, running or stopping
     */
    public boolean isProcessExpected() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }
}
