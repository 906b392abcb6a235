package me.internalizable.testenv.environment;

/**
 * An environment scope was entered while another one is still active.
 */
public class NestedScopeException extends IllegalStateException {

    public NestedScopeException(String message) {
        super(message);
    }
}
