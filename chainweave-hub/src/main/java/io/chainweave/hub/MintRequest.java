// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.chainweave.core.types.Address;
import io.chainweave.core.types.HexData;
import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;

/**
 * A mint request as recorded by the hub. Immutable; every transition creates a new instance.
 *
 * <p>Invariants: {@code tokenId} is set exactly when the status is
 * {@link RequestStatus#COMPLETED}, and {@code failureReason} exactly when it is
 * {@link RequestStatus#FAILED}.
 *
 * @param requestId          keccak256(requester, prompt, nonce, hub chain id)
 * @param requester          account that submitted and paid for the request
 * @param prompt             generation prompt
 * @param destinationChainId chain the token is minted on
 * @param recipient          chain-specific recipient encoding
 * @param status             lifecycle state
 * @param fee                escrowed fee, equal to the minimum fee at submission
 * @param tokenUri           metadata URI, empty until generation completes
 * @param tokenId            minted token id, once completed
 * @param failureReason      why the request failed, while failed
 * @param retryCount         retries used so far
 * @param deliveryId         transport id of the latest mint instruction, once dispatched
 * @param createdAt          submission time
 * @param updatedAt          time of the latest transition
 */
public record MintRequest(
        RequestId requestId,
        Address requester,
        String prompt,
        long destinationChainId,
        HexData recipient,
        RequestStatus status,
        Wei fee,
        String tokenUri,
        @Nullable Long tokenId,
        @Nullable String failureReason,
        int retryCount,
        @Nullable String deliveryId,
        Instant createdAt,
        Instant updatedAt) {

    public MintRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(requester, "requester");
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(fee, "fee");
        Objects.requireNonNull(tokenUri, "tokenUri");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if ((tokenId != null) != (status == RequestStatus.COMPLETED)) {
            throw new IllegalArgumentException("tokenId must be set exactly when COMPLETED, status " + status);
        }
        if ((failureReason != null) != (status == RequestStatus.FAILED)) {
            throw new IllegalArgumentException("failureReason must be set exactly when FAILED, status " + status);
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative, got: " + retryCount);
        }
    }

    static MintRequest pending(
            final RequestId requestId,
            final Address requester,
            final String prompt,
            final long destinationChainId,
            final HexData recipient,
            final Wei fee,
            final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                RequestStatus.PENDING, fee, "", null, null, 0, null, now, now);
    }

    MintRequest processing(final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                RequestStatus.PROCESSING, fee, tokenUri, null, null, retryCount, deliveryId, createdAt, now);
    }

    MintRequest generated(final String uri, final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                RequestStatus.AI_COMPLETED, fee, uri, null, null, retryCount, deliveryId, createdAt, now);
    }

    MintRequest withTokenUri(final String uri, final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                status, fee, uri, tokenId, failureReason, retryCount, deliveryId, createdAt, now);
    }

    MintRequest dispatched(final String newDeliveryId, final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                RequestStatus.CROSS_CHAIN_PENDING, fee, tokenUri, null, null, retryCount, newDeliveryId,
                createdAt, now);
    }

    MintRequest completed(final long mintedTokenId, final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                RequestStatus.COMPLETED, fee, tokenUri, mintedTokenId, null, retryCount, deliveryId, createdAt, now);
    }

    MintRequest failed(final String reason, final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                RequestStatus.FAILED, fee, tokenUri, null, reason, retryCount, deliveryId, createdAt, now);
    }

    MintRequest cancelled(final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                RequestStatus.CANCELLED, fee, tokenUri, null, null, retryCount, deliveryId, createdAt, now);
    }

    /** Back to PENDING with one more retry used; generation output is discarded. */
    MintRequest retried(final Instant now) {
        return new MintRequest(requestId, requester, prompt, destinationChainId, recipient,
                RequestStatus.PENDING, fee, "", null, null, retryCount + 1, null, createdAt, now);
    }
}
