package me.internalizable.testenv.environment.fleet;

import me.internalizable.testenv.api.ServerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Running servers of one environment scope, grouped by scheme in start order.
 */
public final class ServerFleet {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerFleet.class);

    private final Map<String, List<FleetEntry>> servers;

    private ServerFleet(Map<String, List<FleetEntry>> servers) {
        Map<String, List<FleetEntry>> copy = new LinkedHashMap<>();
        servers.forEach((scheme, entries) -> copy.put(scheme, List.copyOf(entries)));
        this.servers = Collections.unmodifiableMap(copy);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public static ServerFleet empty() {
        return new ServerFleet(Map.of());
    }

    @Nonnull
    public Set<String> getSchemes() {
        return servers.keySet();
    }

    @Nonnull
    public List<FleetEntry> getServers(@Nonnull String scheme) {
        return servers.getOrDefault(scheme, List.of());
    }

    /**
     * Get every server, scheme by scheme.
     *
     * @return all entries
     */
    @Nonnull
    public List<FleetEntry> getEntries() {
        List<FleetEntry> entries = new ArrayList<>();
        servers.values().forEach(entries::addAll);
        return entries;
    }

    public int size() {
        return servers.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Terminate every server. All handles are asked to stop even if some fail;
     * the first failure is rethrown afterwards with the rest suppressed.
     */
    public void terminateAll() {
        RuntimeException failure = null;
        for (FleetEntry entry : getEntries()) {
            try {
                entry.handle().terminate();
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to terminate {} server on port {}: {}",
                        entry.scheme(), entry.port(), e.getMessage());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        Map<String, List<Integer>> ports = new LinkedHashMap<>();
        servers.forEach((scheme, entries) -> {
            List<Integer> list = new ArrayList<>();
            entries.forEach(e -> list.add(e.port()));
            ports.put(scheme, list);
        });
        return "ServerFleet" + ports;
    }

    /**
     * Builder for {@link ServerFleet}.
     */
    public static final class Builder {

        private final Map<String, List<FleetEntry>> servers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(@Nonnull String scheme, int port, @Nonnull ServerHandle handle) {
            Objects.requireNonNull(scheme, "scheme");
            servers.computeIfAbsent(scheme, s -> new ArrayList<>()).add(new FleetEntry(scheme, port, handle));
            return this;
        }

        public ServerFleet build() {
            return new ServerFleet(servers);
        }
    }
}
