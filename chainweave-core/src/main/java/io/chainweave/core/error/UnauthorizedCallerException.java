// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

import io.chainweave.core.types.Address;

/**
 * Thrown when the caller identity passed to a guarded operation does not match
 * the identity the operation requires, including forged gateway callbacks.
 *
 * @since 0.1.0
 */
public final class UnauthorizedCallerException extends ChainWeaveException {

    private final Address caller;

    public UnauthorizedCallerException(final Address caller, final String requiredRole) {
        super("Caller " + caller + " is not " + requiredRole);
        this.caller = caller;
    }

    public Address caller() {
        return caller;
    }
}
