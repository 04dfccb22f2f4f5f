// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

import io.chainweave.core.types.RequestId;

/**
 * {@link ProcessedRequestStore} held in memory. Not durable.
 */
public final class InMemoryProcessedRequestStore implements ProcessedRequestStore {

    private final Map<RequestId, Long> processed = new HashMap<>();
    private final TreeMap<Long, MintedToken> tokens = new TreeMap<>();
    private long totalVolume;

    @Override
    public synchronized boolean markProcessed(final MintedToken token) {
        Objects.requireNonNull(token, "token");
        if (processed.containsKey(token.sourceRequestId())) {
            return false;
        }
        if (tokens.containsKey(token.tokenId())) {
            throw new IllegalStateException("Token " + token.tokenId() + " already exists");
        }
        processed.put(token.sourceRequestId(), token.tokenId());
        tokens.put(token.tokenId(), token);
        totalVolume++;
        return true;
    }

    @Override
    public synchronized OptionalLong tokenFor(final RequestId requestId) {
        final Long tokenId = processed.get(requestId);
        return tokenId == null ? OptionalLong.empty() : OptionalLong.of(tokenId);
    }

    @Override
    public synchronized Optional<MintedToken> token(final long tokenId) {
        return Optional.ofNullable(tokens.get(tokenId));
    }

    @Override
    public synchronized List<MintedToken> tokens() {
        return List.copyOf(tokens.values());
    }

    @Override
    public synchronized long maxTokenId() {
        return tokens.isEmpty() ? 0 : tokens.lastKey();
    }

    @Override
    public synchronized void update(final List<MintedToken> changed, final int movements) {
        for (final MintedToken token : changed) {
            if (!tokens.containsKey(token.tokenId())) {
                throw new IllegalArgumentException("Token " + token.tokenId() + " does not exist");
            }
        }
        for (final MintedToken token : changed) {
            tokens.put(token.tokenId(), token);
        }
        totalVolume += movements;
    }

    @Override
    public synchronized long totalVolume() {
        return totalVolume;
    }

    /** Number of processed request ids. */
    public synchronized int size() {
        return processed.size();
    }
}
