// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.codec;

import java.util.Objects;

import io.chainweave.core.types.HexData;
import io.chainweave.core.types.RequestId;

/**
 * Hub-to-minter instruction to mint the token for one request.
 *
 * <p>Wire layout: {@code (bytes32 requestId, bytes recipient, string tokenURI, uint256 royaltyBps)}.
 *
 * @param requestId  idempotency key of the request
 * @param recipient  chain-specific recipient address encoding
 * @param tokenUri   metadata URI produced by the generation pipeline
 * @param royaltyBps royalty in basis points
 */
public record MintInstruction(RequestId requestId, HexData recipient, String tokenUri, int royaltyBps) {

    public MintInstruction {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(tokenUri, "tokenUri");
        if (royaltyBps < 0) {
            throw new IllegalArgumentException("royaltyBps must be non-negative, got: " + royaltyBps);
        }
    }
}
