// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.codec;

import java.util.Objects;

import io.chainweave.core.types.RequestId;

/**
 * Minter-to-hub acknowledgement of a mint instruction.
 *
 * <p>Wire layout: {@code (bytes32 requestId, bool success, uint256 tokenId, string reason)}.
 * A failed result may still carry a token id, when the failure is a duplicate
 * delivery of an instruction that was already minted.
 */
public record MintResult(RequestId requestId, boolean success, long tokenId, String reason) {

    public MintResult {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(reason, "reason");
        if (tokenId < 0) {
            throw new IllegalArgumentException("tokenId must be non-negative, got: " + tokenId);
        }
    }

    public static MintResult success(final RequestId requestId, final long tokenId) {
        return new MintResult(requestId, true, tokenId, "");
    }

    public static MintResult failure(final RequestId requestId, final String reason) {
        return new MintResult(requestId, false, 0L, reason);
    }

    public static MintResult failure(final RequestId requestId, final long existingTokenId, final String reason) {
        return new MintResult(requestId, false, existingTokenId, reason);
    }
}
