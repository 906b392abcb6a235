package me.internalizable.testenv.environment.shared;

/**
 * Shared state service started and stopped with an environment scope.
 *
 * <p>Implementations must be safe for concurrent use by every server worker.</p>
 */
public interface SharedResource {

    /**
     * Start the service.
     *
     * @throws Exception if the service cannot start
     */
    void start() throws Exception;

    /**
     * Stop the service and drop its state.
     *
     * @throws Exception if stopping fails
     */
    void stop() throws Exception;

    boolean isRunning();
}
