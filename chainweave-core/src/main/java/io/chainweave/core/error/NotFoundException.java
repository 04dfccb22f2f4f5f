// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

/**
 * Thrown when a request, token or chain referenced by an operation does not exist.
 *
 * @since 0.1.0
 */
public final class NotFoundException extends ValidationException {

    public NotFoundException(final String message) {
        super(message);
    }
}
