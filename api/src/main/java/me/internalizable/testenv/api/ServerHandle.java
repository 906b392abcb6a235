package me.internalizable.testenv.api;

/**
 * Handle to one running protocol server of the fleet.
 */
public interface ServerHandle {

    /**
     * Check if the server is still running.
     *
     * @return true if alive
     */
    boolean isAlive();

    /**
     * Stop the server. Calling this on a server that already exited is a no-op.
     */
    void terminate();
}
