// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

/**
 * Observable progress of an outbound message.
 */
public enum DeliveryStatus {
    /** Accepted by the transport, not yet executed on the destination. */
    QUEUED,
    /** Executed on the destination without error. */
    DELIVERED,
    /** The destination call failed; the revert payload, if any, goes back to the sender. */
    REVERTED
}
