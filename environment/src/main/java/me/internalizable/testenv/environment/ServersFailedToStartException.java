package me.internalizable.testenv.environment;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Some servers of the fleet died or never became reachable.
 */
public class ServersFailedToStartException extends TestEnvironmentException {

    public static final String MESSAGE_PREFIX = "Servers failed to start: ";

    private final List<String> endpoints;
    private final boolean timedOut;

    /**
     * Create the exception.
     *
     * @param endpoints offending endpoints rendered as {@code name:port}
     * @param timedOut true if the startup budget ran out with servers still pending
     */
    public ServersFailedToStartException(@Nonnull List<String> endpoints, boolean timedOut) {
        super(MESSAGE_PREFIX + String.join(", ", endpoints));
        this.endpoints = List.copyOf(endpoints);
        this.timedOut = timedOut;
    }

    @Nonnull
    public List<String> getEndpoints() {
        return endpoints;
    }

    /**
     * Check whether this failure came from the startup budget running out.
     *
     * @return true for pending servers, false for dead ones
     */
    public boolean isTimedOut() {
        return timedOut;
    }
}
