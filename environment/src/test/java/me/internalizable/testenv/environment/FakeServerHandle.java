package me.internalizable.testenv.environment;

import me.internalizable.testenv.api.ServerHandle;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server handle whose liveness is set by the test.
 */
public class FakeServerHandle implements ServerHandle {

    private final String name;
    private final List<String> events;
    private final AtomicBoolean alive;
    private final AtomicBoolean terminated = new AtomicBoolean();

    public FakeServerHandle(String name, boolean alive, List<String> events) {
        this.name = name;
        this.alive = new AtomicBoolean(alive);
        this.events = events;
    }

    public FakeServerHandle(boolean alive) {
        this("server", alive, null);
    }

    @Override
    public boolean isAlive() {
        return alive.get();
    }

    @Override
    public void terminate() {
        terminated.set(true);
        alive.set(false);
        if (events != null) {
            events.add("terminate " + name);
        }
    }

    public void setAlive(boolean value) {
        alive.set(value);
    }

    public boolean isTerminated() {
        return terminated.get();
    }
}
