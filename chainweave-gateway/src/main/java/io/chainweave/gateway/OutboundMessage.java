// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.chainweave.core.types.Address;
import io.chainweave.core.types.HexData;

/**
 * A message handed to a {@link MessageTransport}.
 */
public record OutboundMessage(
        long sourceChainId,
        Address sourceEndpoint,
        long targetChainId,
        Address targetEndpoint,
        HexData payload,
        @Nullable HexData revertPayload) {

    public OutboundMessage {
        Objects.requireNonNull(sourceEndpoint, "sourceEndpoint");
        Objects.requireNonNull(targetEndpoint, "targetEndpoint");
        Objects.requireNonNull(payload, "payload");
    }
}
