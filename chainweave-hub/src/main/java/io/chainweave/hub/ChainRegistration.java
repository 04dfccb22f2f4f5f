// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import java.util.Objects;

import io.chainweave.core.types.Address;

/**
 * A destination chain known to the hub.
 *
 * <p>Only enabled chains accept new requests. Dispatch always uses the recorded
 * endpoint, so disabling a chain does not strand requests already accepted for it.
 *
 * @param chainId        destination chain id
 * @param minterEndpoint gateway endpoint of the chain's minter
 * @param enabled        whether new requests may target the chain
 */
public record ChainRegistration(long chainId, Address minterEndpoint, boolean enabled) {

    public ChainRegistration {
        Objects.requireNonNull(minterEndpoint, "minterEndpoint");
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be > 0, got: " + chainId);
        }
        if (minterEndpoint.isZero()) {
            throw new IllegalArgumentException("minterEndpoint must be non-zero");
        }
    }

    ChainRegistration disabled() {
        return new ChainRegistration(chainId, minterEndpoint, false);
    }
}
