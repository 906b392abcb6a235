package me.internalizable.testenv.environment;

/**
 * The server fleet could not be spawned.
 */
public class FleetStartException extends TestEnvironmentException {

    public FleetStartException(String message) {
        super(message);
    }

    public FleetStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
