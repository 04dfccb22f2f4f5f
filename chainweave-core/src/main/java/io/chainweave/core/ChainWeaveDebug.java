// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core;

/**
 * Global toggle for verbose protocol tracing across ChainWeave modules.
 *
 * <p>Two independent categories: message traffic through gateways and transports,
 * and state transitions in the hub and minters.
 */
public final class ChainWeaveDebug {

    private static volatile boolean messageLogging = false;
    private static volatile boolean stateLogging = false;

    private ChainWeaveDebug() {
    }

    /**
     * @return true if either category is enabled
     */
    public static boolean isEnabled() {
        return messageLogging || stateLogging;
    }

    public static void setEnabled(final boolean enabled) {
        messageLogging = enabled;
        stateLogging = enabled;
    }

    public static void setMessageLogging(final boolean enabled) {
        messageLogging = enabled;
    }

    public static boolean isMessageLoggingEnabled() {
        return messageLogging;
    }

    public static void setStateLogging(final boolean enabled) {
        stateLogging = enabled;
    }

    public static boolean isStateLoggingEnabled() {
        return stateLogging;
    }
}
