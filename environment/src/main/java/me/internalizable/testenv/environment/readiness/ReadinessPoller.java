package me.internalizable.testenv.environment.readiness;

import me.internalizable.testenv.environment.ServersFailedToStartException;
import me.internalizable.testenv.environment.TestEnvironmentException;
import me.internalizable.testenv.environment.fleet.FleetEntry;
import me.internalizable.testenv.environment.fleet.ServerFleet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Verifies that a fleet came up before tests run.
 *
 * <p>A dead server process is fatal immediately. A live server whose port
 * does not accept connections yet is pending and is polled again until the
 * startup budget runs out.</p>
 */
public class ReadinessPoller {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReadinessPoller.class);

    private final PortProber prober;
    private final boolean probePorts;
    private final Set<String> unprobeableSchemes;
    private final Duration pollInterval;
    private final Duration startupTimeout;

    /**
     * Create a poller.
     *
     * @param prober port prober
     * @param probePorts whether to check ports at all, or only process liveness
     * @param unprobeableSchemes schemes whose ports cannot be checked by a TCP connect
     * @param pollInterval pause between polls
     * @param startupTimeout total time allowed for servers to become reachable
     */
    public ReadinessPoller(
            @Nonnull PortProber prober,
            boolean probePorts,
            @Nonnull Set<String> unprobeableSchemes,
            @Nonnull Duration pollInterval,
            @Nonnull Duration startupTimeout) {
        this.prober = Objects.requireNonNull(prober, "prober");
        this.probePorts = probePorts;
        this.unprobeableSchemes = Set.copyOf(unprobeableSchemes);
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.startupTimeout = Objects.requireNonNull(startupTimeout, "startupTimeout");
    }

    /**
     * Take one health snapshot of the fleet.
     *
     * <p>Ports are only probed when no server has died.</p>
     *
     * @param fleet the fleet
     * @param host host the servers listen on
     * @return the report
     */
    @Nonnull
    public ReadinessReport testServers(@Nonnull ServerFleet fleet, @Nonnull String host) {
        Objects.requireNonNull(fleet, "fleet");
        Objects.requireNonNull(host, "host");

        Set<Endpoint> failed = new LinkedHashSet<>();
        for (FleetEntry entry : fleet.getEntries()) {
            if (!entry.handle().isAlive()) {
                failed.add(new Endpoint(entry.scheme(), entry.port()));
            }
        }
        if (!failed.isEmpty() || !probePorts) {
            return new ReadinessReport(failed, Set.of());
        }

        Set<Endpoint> pending = new LinkedHashSet<>();
        for (FleetEntry entry : fleet.getEntries()) {
            if (unprobeableSchemes.contains(entry.scheme())) {
                continue;
            }
            if (!prober.canConnect(host, entry.port())) {
                pending.add(new Endpoint(host, entry.port()));
            }
        }
        return new ReadinessReport(failed, pending);
    }

    /**
     * Poll until every server is ready.
     *
     * @param fleet the fleet
     * @param host host the servers listen on
     * @throws ServersFailedToStartException if a server died, or servers were still
     *         pending when the startup budget ran out
     */
    public void ensureStarted(@Nonnull ServerFleet fleet, @Nonnull String host) {
        long deadline = System.nanoTime() + startupTimeout.toNanos();
        int polls = 0;

        while (true) {
            ReadinessReport report = testServers(fleet, host);
            polls++;

            if (!report.getFailed().isEmpty()) {
                LOGGER.error("Servers died during startup: {}", report.getFailed());
                throw new ServersFailedToStartException(render(report.getFailed()), false);
            }
            if (report.getPending().isEmpty()) {
                LOGGER.info("All {} servers ready after {} poll(s)", fleet.size(), polls);
                return;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                LOGGER.error("Servers still unreachable after {}ms: {}",
                        startupTimeout.toMillis(), report.getPending());
                throw new ServersFailedToStartException(render(report.getPending()), true);
            }

            LOGGER.debug("Waiting for servers: {}", report.getPending());
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(pollInterval.toNanos(), remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TestEnvironmentException("Interrupted while waiting for servers to start", e);
            }
        }
    }

    private static List<String> render(Set<Endpoint> endpoints) {
        List<String> rendered = new ArrayList<>(endpoints.size());
        endpoints.forEach(e -> rendered.add(e.toString()));
        return rendered;
    }
}
