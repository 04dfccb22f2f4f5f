// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import io.chainweave.core.types.RequestId;

/**
 * Durable record of the request ids a minter has fulfilled and the tokens they
 * produced. This is the idempotency record that must survive restarts: a
 * minter opened over an existing store continues from its highest token id.
 *
 * <p>Implementations must make each method atomic with respect to the others.
 */
public interface ProcessedRequestStore {

    /**
     * Records {@code token.sourceRequestId()} as fulfilled by {@code token} unless
     * the request is already recorded. A recorded mint counts as one movement.
     *
     * @return true if recorded, false if the request id was already present
     * @throws IllegalStateException if another token already holds {@code token.tokenId()}
     */
    boolean markProcessed(MintedToken token);

    /** Token minted for {@code requestId}, if any. */
    OptionalLong tokenFor(RequestId requestId);

    default boolean isProcessed(final RequestId requestId) {
        return tokenFor(requestId).isPresent();
    }

    Optional<MintedToken> token(long tokenId);

    /** All tokens, ascending by id. */
    List<MintedToken> tokens();

    /** Highest token id recorded, or 0 when no token exists. */
    long maxTokenId();

    /**
     * Replaces the stored state of existing tokens in one step.
     *
     * @param changed   new state of each token, keyed by its id
     * @param movements how many of them changed owner
     * @throws IllegalArgumentException if a token id is not recorded
     */
    void update(List<MintedToken> changed, int movements);

    /** Mints plus ownership transfers recorded so far. */
    long totalVolume();
}
