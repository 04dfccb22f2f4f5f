// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;

/**
 * Outcome of {@link RequestRegistry#submit}: {@code chargedFee + refund} equals the fee paid.
 */
public record SubmitReceipt(RequestId requestId, Wei chargedFee, Wei refund) {
}
