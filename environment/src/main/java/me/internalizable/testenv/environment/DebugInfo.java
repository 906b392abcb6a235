package me.internalizable.testenv.environment;

/**
 * Describes a debugger attached to the browser under test.
 *
 * @param interactive true if an operator drives the debugger
 */
public record DebugInfo(boolean interactive) {
}
