// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.error;

/**
 * Thrown when an operation is not permitted from the request's current state,
 * for example cancelling a request whose cross-chain dispatch has started.
 *
 * @since 0.1.0
 */
public final class InvalidTransitionException extends ChainWeaveException {

    private final String currentState;
    private final String operation;

    public InvalidTransitionException(final String operation, final String currentState) {
        super("Cannot " + operation + " a request in state " + currentState);
        this.operation = operation;
        this.currentState = currentState;
    }

    public String currentState() {
        return currentState;
    }

    public String operation() {
        return operation;
    }
}
