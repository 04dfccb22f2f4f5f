// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.chainweave.core.types.Address;
import io.chainweave.core.types.RequestId;

/**
 * A token issued by a {@link DestinationMinter}. Immutable; updates produce new instances.
 *
 * @param tokenId         chain-local sequential id, starting at 1
 * @param owner           current holder
 * @param tokenUri        metadata URI
 * @param royaltyBps      royalty in basis points
 * @param sourceRequestId hub request this token fulfils
 * @param mintedAt        mint time
 * @param approved        delegate allowed to transfer or update the token, if any
 */
public record MintedToken(
        long tokenId,
        Address owner,
        String tokenUri,
        int royaltyBps,
        RequestId sourceRequestId,
        Instant mintedAt,
        @Nullable Address approved) {

    public MintedToken {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(tokenUri, "tokenUri");
        Objects.requireNonNull(sourceRequestId, "sourceRequestId");
        Objects.requireNonNull(mintedAt, "mintedAt");
        if (tokenId <= 0) {
            throw new IllegalArgumentException("tokenId must be > 0, got: " + tokenId);
        }
    }

    /** Whether {@code account} owns the token or is its approved delegate. */
    public boolean isOwnerOrApproved(final Address account) {
        return owner.equals(account) || account.equals(approved);
    }

    /** New owner; clears any approval. */
    MintedToken withOwner(final Address newOwner) {
        return new MintedToken(tokenId, newOwner, tokenUri, royaltyBps, sourceRequestId, mintedAt, null);
    }

    MintedToken withTokenUri(final String newUri) {
        return new MintedToken(tokenId, owner, newUri, royaltyBps, sourceRequestId, mintedAt, approved);
    }

    MintedToken withRoyaltyBps(final int bps) {
        return new MintedToken(tokenId, owner, tokenUri, bps, sourceRequestId, mintedAt, approved);
    }

    MintedToken withApproved(final @Nullable Address delegate) {
        return new MintedToken(tokenId, owner, tokenUri, royaltyBps, sourceRequestId, mintedAt, delegate);
    }
}
