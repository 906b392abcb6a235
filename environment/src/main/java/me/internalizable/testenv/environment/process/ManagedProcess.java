package me.internalizable.testenv.environment.process;

import me.internalizable.testenv.api.ServerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A server worker running as an operating system process.
 *
 * <p>Wraps the {@link Process} with the scheme and port it serves.</p>
 */
public class ManagedProcess implements ServerHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManagedProcess.class);

    private static final long KILL_WAIT_SECONDS = 5;

    private final String serverId;
    private final int port;
    private final Process process;
    private final Duration gracefulStopTimeout;

    private volatile Integer exitCode = null;

    /**
     * Create a managed process.
     *
     * @param scheme scheme served by the worker
     * @param port port served by the worker
     * @param process the running process
     * @param gracefulStopTimeout how long {@link #terminate()} waits before killing
     */
    public ManagedProcess(
            @Nonnull String scheme,
            int port,
            @Nonnull Process process,
            @Nonnull Duration gracefulStopTimeout) {
        this.port = port;
        this.serverId = Objects.requireNonNull(scheme, "scheme") + "-" + port;
        this.process = Objects.requireNonNull(process, "process");
        this.gracefulStopTimeout = Objects.requireNonNull(gracefulStopTimeout, "gracefulStopTimeout");
    }

    @Nonnull
    public String getServerId() {
        return serverId;
    }

    public int getPort() {
        return port;
    }

    @Nonnull
    public Process getProcess() {
        return process;
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Get the exit code if the process has terminated.
     *
     * @return exit code, or null if still running
     */
    @Nullable
    public Integer getExitCode() {
        if (exitCode != null) {
            return exitCode;
        }
        if (!process.isAlive()) {
            exitCode = process.exitValue();
            return exitCode;
        }
        return null;
    }

    /**
     * Ask the process to stop, then kill it if it is still running after the
     * graceful timeout.
     */
    @Override
    public void terminate() {
        if (!process.isAlive()) {
            return;
        }

        process.destroy();
        try {
            if (process.waitFor(gracefulStopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.debug("Server '{}' stopped gracefully", serverId);
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOGGER.warn("Server '{}' did not stop within {}ms, forcing...", serverId, gracefulStopTimeout.toMillis());
        process.destroyForcibly();
        try {
            process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "ManagedProcess{" +
                "serverId='" + serverId + '\'' +
                ", pid=" + process.pid() +
                ", alive=" + isAlive() +
                '}';
    }
}
