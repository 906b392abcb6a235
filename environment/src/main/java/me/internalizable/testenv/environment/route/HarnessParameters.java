package me.internalizable.testenv.environment.route;

import me.internalizable.testenv.environment.DebugInfo;

import javax.annotation.Nullable;

/**
 * Values substituted into the harness report script.
 *
 * @param timeoutMultiplier multiplier applied to test timeouts
 * @param pauseAfterTest keep the window open after each test
 * @param debugTest enable harness debug output
 * @param debugInfo attached debugger, or null
 */
public record HarnessParameters(
        double timeoutMultiplier,
        boolean pauseAfterTest,
        boolean debugTest,
        @Nullable DebugInfo debugInfo) {

    public static HarnessParameters defaults() {
        return new HarnessParameters(1.0, false, false, null);
    }
}
