// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

import java.util.Objects;

import io.chainweave.core.types.Address;

/**
 * Metadata the transport attaches to an inbound delivery.
 *
 * @param sender         the principal that performed the delivery; only the
 *                       transport principal is trusted
 * @param sourceChainId  chain the message originated from
 * @param sourceEndpoint gateway endpoint that sent the message
 */
public record CallContext(Address sender, long sourceChainId, Address sourceEndpoint) {

    public CallContext {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(sourceEndpoint, "sourceEndpoint");
    }
}
