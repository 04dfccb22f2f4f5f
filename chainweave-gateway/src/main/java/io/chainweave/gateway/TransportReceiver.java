// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

/**
 * Entry points a {@link MessageTransport} invokes on the receiving endpoint.
 */
public interface TransportReceiver {

    /** A message sent to this endpoint is being executed. */
    void onInboundCall(CallContext context, byte[] payload);

    /** A message this endpoint sent earlier failed at its destination. */
    void onInboundFailure(CallContext context, byte[] payload);
}
