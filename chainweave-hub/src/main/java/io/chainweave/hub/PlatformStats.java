// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import io.chainweave.core.types.Wei;

/**
 * Hub-wide counters, updated in the same step as the transition they count.
 *
 * @param totalRequests      requests ever submitted
 * @param completedMints     requests that reached COMPLETED
 * @param totalFeesCollected fees charged at submission
 * @param activeChains       enabled destination chains
 * @param totalFeesRefunded  fees returned by cancellation
 * @param failedMints        failure notices that moved a request to FAILED
 */
public record PlatformStats(
        long totalRequests,
        long completedMints,
        Wei totalFeesCollected,
        int activeChains,
        Wei totalFeesRefunded,
        long failedMints) {
}
