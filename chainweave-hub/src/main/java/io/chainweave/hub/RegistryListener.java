// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;
import io.chainweave.gateway.DeliveryHandle;

/**
 * Receives lifecycle events from a {@link RequestRegistry}, for metrics or auditing.
 *
 * <p>Callbacks run inside the registry's critical section and must be fast and
 * must not call back into the registry. By default a no-op implementation is
 * used ({@link #noop()}).
 */
public interface RegistryListener {

    /**
     * Called when a request is accepted.
     */
    default void onSubmitted(MintRequest request) {
    }

    /**
     * Called after every status change.
     */
    default void onStatusChanged(RequestId requestId, RequestStatus from, RequestStatus to) {
    }

    /**
     * Called when a mint instruction is handed to the gateway, including redispatches.
     */
    default void onDispatched(RequestId requestId, DeliveryHandle handle) {
    }

    /**
     * Called when a success or failure notice arrives for a request that is no
     * longer waiting for one.
     */
    default void onNoticeIgnored(RequestId requestId, RequestStatus current) {
    }

    default void onFeesWithdrawn(Wei amount) {
    }

    static RegistryListener noop() {
        return NoopRegistryListener.INSTANCE;
    }
}

enum NoopRegistryListener implements RegistryListener {
    INSTANCE
}
