package me.internalizable.testenv.environment;

/**
 * Base class for failures raised by the test environment.
 */
public class TestEnvironmentException extends RuntimeException {

    public TestEnvironmentException(String message) {
        super(message);
    }

    public TestEnvironmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
