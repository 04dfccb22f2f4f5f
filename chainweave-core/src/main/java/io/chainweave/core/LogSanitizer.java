// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core;

import java.util.regex.Pattern;

/**
 * Removes sensitive data from log payloads and bounds their size.
 *
 * <p>
 * Redacts private key values and truncates oversized lines. {@link #abbreviate}
 * shortens user-supplied text such as prompts and token URIs before it is logged.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY_PATTERN =
            Pattern.compile("\"privateKey\"\\s*:\\s*\"0x[^\"]+\"");

    private static final String PRIVATE_KEY_REPLACEMENT = "\"privateKey\":\"0x***[REDACTED]***\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;
        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(PRIVATE_KEY_REPLACEMENT);
        }
        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }
        return sanitized;
    }

    /**
     * Shortens {@code text} to at most {@code maxChars} characters, appending "..." when cut.
     * Line breaks are flattened so one value stays on one log line.
     */
    public static String abbreviate(final String text, final int maxChars) {
        if (text == null) {
            return "null";
        }
        final String flat = text.replace('\n', ' ').replace('\r', ' ');
        if (flat.length() <= maxChars) {
            return flat;
        }
        return flat.substring(0, Math.max(0, maxChars - 3)) + "...";
    }
}
