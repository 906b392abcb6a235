package me.internalizable.testenv.environment;

/**
 * Switches process interrupt handling off while an interactive debugger is attached.
 */
public interface InterruptControl {

    /**
     * Ignore interrupt signals, remembering the current handler.
     */
    void ignoreInterrupts();

    /**
     * Put back the handler that was active before {@link #ignoreInterrupts()}.
     */
    void restoreInterrupts();
}
