// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

import io.chainweave.core.types.RequestId;

/**
 * Thrown by a destination minter when a mint instruction carries a request id
 * that has already been processed on that chain.
 *
 * @since 0.1.0
 */
public final class DuplicateRequestException extends ChainWeaveException {

    private final RequestId requestId;
    private final long existingTokenId;

    public DuplicateRequestException(final RequestId requestId, final long existingTokenId) {
        super("duplicate request " + requestId + " already minted as token " + existingTokenId);
        this.requestId = requestId;
        this.existingTokenId = existingTokenId;
    }

    public RequestId requestId() {
        return requestId;
    }

    public long existingTokenId() {
        return existingTokenId;
    }
}
