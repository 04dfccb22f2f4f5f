// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("io.chainweave.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        ChainWeaveDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.log("should not appear");
        DebugLogger.logMessage("nor this");
        DebugLogger.logState("nor this");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        ChainWeaveDebug.setEnabled(true);
        DebugLogger.log("payload {\"privateKey\":\"0x123\"}");

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("0x***[REDACTED]***"));
    }

    @Test
    void categoriesAreIndependent() {
        ChainWeaveDebug.setStateLogging(true);

        DebugLogger.logMessage("[SEND] chain=%d", 42);
        DebugLogger.logState("[TRANSITION] %s -> %s", "PENDING", "PROCESSING");

        assertEquals(1, appender.list.size());
        assertEquals("[TRANSITION] PENDING -> PROCESSING", appender.list.get(0).getFormattedMessage());
        assertTrue(ChainWeaveDebug.isEnabled());
    }
}
