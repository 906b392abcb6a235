package me.internalizable.testenv.environment.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Small-object store that lets test resources hand values to each other.
 *
 * <p>Values are scoped by path and key. A key can be put once and taken once:
 * {@link #put} rejects an existing key and {@link #take} removes the value.</p>
 */
public class StashServer implements SharedResource {

    private static final Logger LOGGER = LoggerFactory.getLogger(StashServer.class);

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    @Override
    public void start() {
        if (running) {
            throw new IllegalStateException("Stash already running");
        }
        running = true;
        LOGGER.debug("Stash started");
    }

    @Override
    public void stop() {
        running = false;
        int dropped = values.size();
        values.clear();
        LOGGER.debug("Stash stopped ({} entries dropped)", dropped);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Store a value.
     *
     * @param path resource path the key belongs to
     * @param key key
     * @param value value
     * @throws IllegalStateException if the key is already stashed or the stash is stopped
     */
    public void put(@Nonnull String path, @Nonnull String key, @Nonnull Object value) {
        checkRunning();
        Objects.requireNonNull(value, "value");
        Object previous = values.putIfAbsent(internalKey(path, key), value);
        if (previous != null) {
            throw new IllegalStateException("Key already stashed: " + key + " (path " + path + ")");
        }
    }

    /**
     * Remove and return a value.
     *
     * @param path resource path the key belongs to
     * @param key key
     * @return the value, or null if none was stashed
     */
    @Nullable
    public Object take(@Nonnull String path, @Nonnull String key) {
        checkRunning();
        return values.remove(internalKey(path, key));
    }

    public int size() {
        return values.size();
    }

    private void checkRunning() {
        if (!running) {
            throw new IllegalStateException("Stash not running");
        }
    }

    private static String internalKey(String path, String key) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(key, "key");
        return path + '\u0000' + key;
    }
}
