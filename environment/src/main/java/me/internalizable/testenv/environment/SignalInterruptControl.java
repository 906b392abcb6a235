package me.internalizable.testenv.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;
import sun.misc.SignalHandler;

/**
 * Ignores {@code SIGINT} through the JVM signal API.
 *
 * <p>The JVM's own handler runs the shutdown hooks, so the previous handler
 * is restored rather than the platform default.</p>
 */
public class SignalInterruptControl implements InterruptControl {

    private static final Logger LOGGER = LoggerFactory.getLogger(SignalInterruptControl.class);

    private static final Signal INT = new Signal("INT");

    private SignalHandler previous;

    @Override
    public synchronized void ignoreInterrupts() {
        if (previous != null) {
            return;
        }
        previous = Signal.handle(INT, SignalHandler.SIG_IGN);
        LOGGER.info("Ignoring interrupts while the debugger is attached");
    }

    @Override
    public synchronized void restoreInterrupts() {
        if (previous == null) {
            return;
        }
        Signal.handle(INT, previous);
        previous = null;
        LOGGER.debug("Restored interrupt handling");
    }
}
