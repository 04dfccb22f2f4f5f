// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

/**
 * Thrown when envelope fields cannot be encoded.
 *
 * @since 0.1.0
 */
public final class EnvelopeEncodingException extends ChainWeaveException {

    public EnvelopeEncodingException(final String message) {
        super(message);
    }

    public EnvelopeEncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
