/**
 * Cross-thread log forwarding from server workers to the structured logger.
 *
 * <p>Workers write through a {@link me.internalizable.testenv.environment.logging.LoggerProxy}
 * onto a queue. A single consumer thread drains it through the component's
 * filter chain into a {@link me.internalizable.testenv.environment.logging.LogSink}.</p>
 */
package me.internalizable.testenv.environment.logging;
