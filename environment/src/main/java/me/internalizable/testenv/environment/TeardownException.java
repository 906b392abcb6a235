package me.internalizable.testenv.environment;

/**
 * One or more release steps failed while tearing down an environment scope.
 *
 * <p>The first failure is the cause; later ones are attached as suppressed.</p>
 */
public class TeardownException extends TestEnvironmentException {

    public TeardownException(String message, Throwable cause) {
        super(message, cause);
    }
}
