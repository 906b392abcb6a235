package me.internalizable.testenv.environment.readiness;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fleet health at one polling instant.
 *
 * <p>{@code failed} holds {@code scheme:port} of servers whose process died;
 * {@code pending} holds {@code host:port} of live servers not yet accepting
 * connections.</p>
 */
public final class ReadinessReport {

    private final Set<Endpoint> failed;
    private final Set<Endpoint> pending;

    public ReadinessReport(@Nonnull Set<Endpoint> failed, @Nonnull Set<Endpoint> pending) {
        this.failed = Collections.unmodifiableSet(new LinkedHashSet<>(failed));
        this.pending = Collections.unmodifiableSet(new LinkedHashSet<>(pending));
    }

    @Nonnull
    public Set<Endpoint> getFailed() {
        return failed;
    }

    @Nonnull
    public Set<Endpoint> getPending() {
        return pending;
    }

    public boolean isReady() {
        return failed.isEmpty() && pending.isEmpty();
    }

    @Override
    public String toString() {
        return "ReadinessReport{failed=" + failed + ", pending=" + pending + '}';
    }
}
