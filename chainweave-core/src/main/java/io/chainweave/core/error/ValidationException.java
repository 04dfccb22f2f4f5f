// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

/**
 * Thrown when an operation's input fails validation: unsupported or disabled
 * chain, insufficient fee, empty or oversized prompt, empty recipient, empty
 * token URI, royalty above the cap, or a paused component.
 * <p>
 * Non-sealed so that lookups can report {@link NotFoundException} as a
 * validation failure.
 *
 * @since 0.1.0
 */
public non-sealed class ValidationException extends ChainWeaveException {

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
