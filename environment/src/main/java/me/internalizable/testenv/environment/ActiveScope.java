package me.internalizable.testenv.environment;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide token held by the one test environment currently entered.
 */
public final class ActiveScope {

    private static final AtomicReference<TestEnvironment> ACTIVE = new AtomicReference<>();

    private ActiveScope() {
    }

    static void acquire(@Nonnull TestEnvironment environment) {
        if (!ACTIVE.compareAndSet(null, environment)) {
            throw new NestedScopeException("A test environment is already active; environments cannot be nested");
        }
    }

    static void release(@Nonnull TestEnvironment environment) {
        ACTIVE.compareAndSet(environment, null);
    }

    public static boolean isActive() {
        return ACTIVE.get() != null;
    }

    /**
     * Get the environment holding the token.
     *
     * @return the active environment, or null
     */
    @Nullable
    public static TestEnvironment current() {
        return ACTIVE.get();
    }
}
