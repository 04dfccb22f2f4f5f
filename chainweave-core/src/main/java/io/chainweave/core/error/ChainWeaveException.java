// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

/**
 * Base runtime exception for all ChainWeave protocol failures.
 *
 * <p>
 * Every guard violation in the hub, the destination minter and the gateway is
 * reported synchronously as one of the subclasses below, and the failed
 * operation leaves no partial state behind.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * ChainWeaveException
 * ├── {@link ValidationException} - rejected input (fee, chain, prompt, recipient, royalty, paused)
 * │   └── {@link NotFoundException} - unknown request, token or chain
 * ├── {@link UnauthorizedCallerException} - wrong caller for a guarded operation
 * ├── {@link InvalidTransitionException} - operation not allowed in the current state
 * ├── {@link DuplicateRequestException} - request id already processed by a minter
 * ├── {@link RetryLimitExceededException} - no retries left for a failed request
 * ├── {@link EnvelopeEncodingException} - payload could not be encoded
 * └── {@link EnvelopeDecodingException} - malformed inbound payload
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     registry.retry(requester, requestId);
 * } catch (RetryLimitExceededException e) {
 *     // surface "no retries left" to the user
 * } catch (ChainWeaveException e) {
 *     // any other rejected operation
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class ChainWeaveException extends RuntimeException
        permits ValidationException,
        UnauthorizedCallerException,
        InvalidTransitionException,
        DuplicateRequestException,
        RetryLimitExceededException,
        EnvelopeEncodingException,
        EnvelopeDecodingException {

    public ChainWeaveException(final String message) {
        super(message);
    }

    public ChainWeaveException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
