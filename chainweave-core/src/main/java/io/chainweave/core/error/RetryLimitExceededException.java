// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

import io.chainweave.core.types.RequestId;

/**
 * Thrown when the requester asks to retry a failed request that has already
 * used every retry it is allowed.
 *
 * @since 0.1.0
 */
public final class RetryLimitExceededException extends ChainWeaveException {

    private final RequestId requestId;
    private final int attempts;

    public RetryLimitExceededException(final RequestId requestId, final int attempts) {
        super(String.format("Maximum retry attempts reached for %s (%d used)", requestId, attempts));
        this.requestId = requestId;
        this.attempts = attempts;
    }

    public RequestId requestId() {
        return requestId;
    }

    public int getAttemptCount() {
        return attempts;
    }
}
