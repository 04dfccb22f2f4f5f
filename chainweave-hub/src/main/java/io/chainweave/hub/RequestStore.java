// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import java.util.List;
import java.util.Optional;

import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;

/**
 * Durable, key-addressed storage for the hub's requests, plus the running total
 * of fees already withdrawn (the one ledger value that cannot be rebuilt from
 * the requests).
 *
 * <p>The registry serializes all access, so implementations need not be
 * thread-safe beyond ordinary visibility.
 */
public interface RequestStore {

    /** Inserts or replaces the request with the same id. */
    void save(MintRequest request);

    Optional<MintRequest> find(RequestId requestId);

    /** Every request, in submission order. */
    List<MintRequest> findAll();

    int size();

    /** Total fees withdrawn by the owner so far. */
    Wei withdrawnFees();

    /** Replaces the withdrawn total. */
    void saveWithdrawnFees(Wei total);
}
