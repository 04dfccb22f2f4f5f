// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.codec;

import java.util.Objects;

import io.chainweave.core.types.RequestId;

/**
 * Notice that a cross-chain call for a request could not be executed.
 *
 * <p>Wire layout: {@code (bytes32 requestId, string reason)}. This is the revert
 * payload a sender attaches to an outbound message; the transport hands it back
 * to the sender when the destination call reverts.
 */
public record FailureNotice(RequestId requestId, String reason) {

    public FailureNotice {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(reason, "reason");
    }
}
