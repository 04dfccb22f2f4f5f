// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized trace logger for protocol messages and state transitions.
 *
 * <p>Output goes to the {@code io.chainweave.debug} SLF4J logger and is passed
 * through {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.chainweave.debug");

    private DebugLogger() {
    }

    public static void logMessage(final String message, final Object... args) {
        if (!ChainWeaveDebug.isMessageLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logState(final String message, final Object... args) {
        if (!ChainWeaveDebug.isStateLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!ChainWeaveDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
