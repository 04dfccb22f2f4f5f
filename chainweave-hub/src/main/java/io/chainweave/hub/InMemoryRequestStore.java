// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;

/**
 * {@link RequestStore} kept in memory. Not durable.
 */
public final class InMemoryRequestStore implements RequestStore {

    private final Map<RequestId, MintRequest> requests = new LinkedHashMap<>();
    private Wei withdrawnFees = Wei.ZERO;

    @Override
    public synchronized void save(final MintRequest request) {
        Objects.requireNonNull(request, "request");
        requests.put(request.requestId(), request);
    }

    @Override
    public synchronized Optional<MintRequest> find(final RequestId requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public synchronized List<MintRequest> findAll() {
        return List.copyOf(requests.values());
    }

    @Override
    public synchronized int size() {
        return requests.size();
    }

    @Override
    public synchronized Wei withdrawnFees() {
        return withdrawnFees;
    }

    @Override
    public synchronized void saveWithdrawnFees(final Wei total) {
        withdrawnFees = Objects.requireNonNull(total, "total");
    }
}
