// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

/**
 * Lifecycle of a {@link MintRequest}.
 *
 * <pre>
 * PENDING             -> PROCESSING           markProcessing
 * PENDING|PROCESSING  -> AI_COMPLETED         completeGeneration
 * PENDING|PROCESSING  -> FAILED               failGeneration
 * PENDING|PROCESSING  -> CANCELLED            cancel
 * AI_COMPLETED        -> CROSS_CHAIN_PENDING  dispatchCrossChain
 * CROSS_CHAIN_PENDING -> COMPLETED            onMintSuccess
 * CROSS_CHAIN_PENDING -> FAILED               onMintFailure
 * FAILED              -> PENDING              retry
 * </pre>
 *
 * <p>The declaration order is the forward order of the lifecycle; only
 * {@code retry} moves a request back.
 */
public enum RequestStatus {
    PENDING,
    PROCESSING,
    AI_COMPLETED,
    CROSS_CHAIN_PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * {@code COMPLETED} and {@code CANCELLED}. {@code FAILED} still allows a retry
     * until the retry limit is used up, after which the request is settled as well.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /** States in which generation has not finished and the requester may cancel. */
    public boolean isPreGeneration() {
        return this == PENDING || this == PROCESSING;
    }
}
