package me.internalizable.testenv.api;

import javax.annotation.Nullable;

/**
 * A started extra subsystem, released when the environment scope ends.
 */
@FunctionalInterface
public interface ExtraScope {

    /**
     * Release the subsystem.
     *
     * @param scopeFailure the exception propagating out of the environment scope, or null
     * @throws Exception if releasing fails
     */
    void close(@Nullable Throwable scopeFailure) throws Exception;
}
