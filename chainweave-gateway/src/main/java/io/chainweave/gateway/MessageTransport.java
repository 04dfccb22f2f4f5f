// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

import io.chainweave.core.types.Address;

/**
 * Service provider interface for the underlying one-way transport.
 *
 * <p>A transport delivers at least once and makes no ordering promise. It calls
 * receivers with {@link CallContext#sender()} set to its {@link #principal()}.
 */
public interface MessageTransport {

    /** Principal the transport uses when invoking receivers. */
    Address principal();

    /**
     * Registers the receiver for messages addressed to {@code endpoint} on {@code chainId}.
     */
    void register(long chainId, Address endpoint, TransportReceiver receiver);

    /**
     * Accepts a message for delivery and returns without waiting for it.
     */
    DeliveryHandle submit(OutboundMessage message);
}
