// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

/**
 * Thrown when an inbound cross-chain payload is malformed.
 *
 * @since 0.1.0
 */
public final class EnvelopeDecodingException extends ChainWeaveException {

    public EnvelopeDecodingException(final String message) {
        super(message);
    }

    public EnvelopeDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
