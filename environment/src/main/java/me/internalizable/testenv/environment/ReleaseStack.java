package me.internalizable.testenv.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Ordered stack of release actions pushed while resources are acquired.
 *
 * <p>{@link #releaseAll(Throwable)} runs them last-in first-out. Every action
 * runs even if an earlier one failed; failures are collected and reported
 * together once the stack is empty.</p>
 */
public class ReleaseStack {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReleaseStack.class);

    /**
     * Releases one acquired resource.
     */
    @FunctionalInterface
    public interface Release {

        /**
         * @param scopeFailure exception propagating out of the scope, or null
         * @throws Exception if releasing fails
         */
        void release(@Nullable Throwable scopeFailure) throws Exception;
    }

    private final Deque<Entry> entries = new ArrayDeque<>();

    /**
     * Register a release action.
     *
     * @param name resource name used in diagnostics
     * @param release the action
     */
    public void push(@Nonnull String name, @Nonnull Release release) {
        entries.push(new Entry(Objects.requireNonNull(name, "name"), Objects.requireNonNull(release, "release")));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Run every release action in reverse registration order.
     *
     * @param scopeFailure exception propagating out of the scope, or null
     * @throws TeardownException if any action failed; the first failure is the cause
     */
    public void releaseAll(@Nullable Throwable scopeFailure) {
        List<String> failedNames = new ArrayList<>();
        Exception first = null;

        while (!entries.isEmpty()) {
            Entry entry = entries.pop();
            try {
                entry.release.release(scopeFailure);
                LOGGER.debug("Released {}", entry.name);
            } catch (Exception e) {
                LOGGER.warn("Failed to release {}: {}", entry.name, e.getMessage());
                failedNames.add(entry.name);
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }

        if (first != null) {
            throw new TeardownException("Failed to release " + String.join(", ", failedNames), first);
        }
    }

    private static final class Entry {
        private final String name;
        private final Release release;

        private Entry(String name, Release release) {
            this.name = name;
            this.release = release;
        }
    }
}
