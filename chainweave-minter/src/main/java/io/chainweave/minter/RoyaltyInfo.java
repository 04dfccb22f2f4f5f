// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

import io.chainweave.core.types.Address;
import io.chainweave.core.types.Wei;

/**
 * Royalty owed on a sale: {@code amount = salePrice * royaltyBps / 10000}, paid to {@code receiver}.
 */
public record RoyaltyInfo(Address receiver, Wei amount) {
}
