// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

import io.chainweave.core.types.Address;

/**
 * Handle returned by {@link MessagingGateway#send} as soon as a message is
 * accepted. Completion is never awaited through the handle; the outcome arrives
 * as a separate inbound message.
 */
public interface DeliveryHandle {

    /** Transport-assigned message id, unique per transport. */
    String id();

    long targetChainId();

    Address targetEndpoint();

    /** Current delivery status; may change after {@code send} returns. */
    DeliveryStatus status();
}
