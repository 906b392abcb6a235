package me.internalizable.testenv.environment.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Concurrent cache shared by the server workers of one scope.
 */
public class SharedCache implements SharedResource {

    private static final Logger LOGGER = LoggerFactory.getLogger(SharedCache.class);

    private final Map<String, Object> entries = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    @Override
    public void start() {
        if (running) {
            throw new IllegalStateException("Cache already running");
        }
        running = true;
        LOGGER.debug("Shared cache started");
    }

    @Override
    public void stop() {
        running = false;
        entries.clear();
        LOGGER.debug("Shared cache stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Nullable
    public Object get(@Nonnull String key) {
        checkRunning();
        return entries.get(Objects.requireNonNull(key, "key"));
    }

    public void put(@Nonnull String key, @Nonnull Object value) {
        checkRunning();
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    /**
     * Get a value, computing it atomically if absent.
     *
     * @param key key
     * @param loader computes the value
     * @return the cached or computed value
     */
    @Nonnull
    public Object computeIfAbsent(@Nonnull String key, @Nonnull Function<String, Object> loader) {
        checkRunning();
        return entries.computeIfAbsent(Objects.requireNonNull(key, "key"), loader);
    }

    public int size() {
        return entries.size();
    }

    private void checkRunning() {
        if (!running) {
            throw new IllegalStateException("Shared cache not running");
        }
    }
}
