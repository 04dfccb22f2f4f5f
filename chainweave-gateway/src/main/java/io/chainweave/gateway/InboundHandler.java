// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

import io.chainweave.core.types.Address;

/**
 * Domain-side receiver of authenticated inbound messages.
 *
 * <p>{@code caller} is the identity of the forwarding {@link GatewayAdapter};
 * implementations authorize against it the same way they authorize any other
 * caller. Throwing from {@link #onCall} makes the transport revert the message.
 */
public interface InboundHandler {

    void onCall(Address caller, CallContext context, byte[] payload);

    void onRevert(Address caller, CallContext context, byte[] payload);
}
