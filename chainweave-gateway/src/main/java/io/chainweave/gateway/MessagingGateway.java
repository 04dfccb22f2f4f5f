// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

import org.jspecify.annotations.Nullable;

import io.chainweave.core.types.Address;

/**
 * Outbound side of a cross-chain messaging gateway.
 *
 * <p>Sending is one-way and non-blocking: the call returns once the transport
 * has accepted the message. Results of the remote execution come back later
 * through an {@link InboundHandler}.
 */
public interface MessagingGateway {

    /**
     * Identity this gateway presents as caller when it forwards inbound messages.
     */
    Address identity();

    /**
     * Sends {@code payload} to {@code targetEndpoint} on {@code targetChainId}.
     *
     * @param revertPayload payload delivered back to this gateway's
     *                      {@link InboundHandler#onRevert} if the destination
     *                      call fails, or {@code null} for none
     */
    DeliveryHandle send(long targetChainId, Address targetEndpoint, byte[] payload, byte @Nullable [] revertPayload);

    default DeliveryHandle send(final long targetChainId, final Address targetEndpoint, final byte[] payload) {
        return send(targetChainId, targetEndpoint, payload, null);
    }
}
