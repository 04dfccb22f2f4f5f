// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.chainweave.core.types.Address;
import io.chainweave.core.types.Wei;

/**
 * Initial configuration of a {@link RequestRegistry}.
 *
 * <p>Fee, worker and chain settings are starting values; the owner can change
 * them at runtime through the registry's admin operations.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * HubConfig config = HubConfig.builder()
 *     .hubChainId(7001)
 *     .owner(admin)
 *     .trustedWorker(worker)
 *     .gatewayIdentity(gateway.identity())
 *     .minimumFee(Wei.fromEther("0.002"))
 *     .chain(new ChainRegistration(137, polygonMinter, true))
 *     .build();
 * }</pre>
 *
 * @param hubChainId        chain the hub runs on; part of every request id
 * @param owner             administrator
 * @param trustedWorker     the only account allowed to report generation progress
 * @param gatewayIdentity   identity of the gateway adapter that delivers mint notices
 * @param minimumFee        fee charged per request (at most {@code maxFee})
 * @param maxFee            upper bound for {@code minimumFee}
 * @param maxRetries        retries allowed per request
 * @param maxPromptLength   prompt length limit in characters
 * @param defaultRoyaltyBps royalty written into every mint instruction
 * @param chains            destination chains registered at start-up
 */
public record HubConfig(
        long hubChainId,
        Address owner,
        Address trustedWorker,
        Address gatewayIdentity,
        Wei minimumFee,
        Wei maxFee,
        int maxRetries,
        int maxPromptLength,
        int defaultRoyaltyBps,
        List<ChainRegistration> chains) {

    /** Default fee per request: 0.001 ether. */
    public static final Wei DEFAULT_MINIMUM_FEE = Wei.fromEther("0.001");

    /** Default cap on the fee: 1 ether. */
    public static final Wei DEFAULT_MAX_FEE = Wei.fromEther("1");

    public static final int DEFAULT_MAX_RETRIES = 3;

    public static final int DEFAULT_MAX_PROMPT_LENGTH = 500;

    /** Default royalty: 500 bps (5%). */
    public static final int DEFAULT_ROYALTY_BPS = 500;

    /** Royalties above 1000 bps are rejected by minters. */
    public static final int MAX_ROYALTY_BPS = 1000;

    public HubConfig {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(trustedWorker, "trustedWorker");
        Objects.requireNonNull(gatewayIdentity, "gatewayIdentity");
        Objects.requireNonNull(minimumFee, "minimumFee");
        Objects.requireNonNull(maxFee, "maxFee");
        chains = List.copyOf(Objects.requireNonNull(chains, "chains"));
        if (hubChainId <= 0) {
            throw new IllegalArgumentException("hubChainId must be > 0, got: " + hubChainId);
        }
        if (owner.isZero() || trustedWorker.isZero() || gatewayIdentity.isZero()) {
            throw new IllegalArgumentException("owner, trustedWorker and gatewayIdentity must be non-zero");
        }
        if (maxFee.compareTo(minimumFee) < 0) {
            throw new IllegalArgumentException(
                    "minimumFee must be <= maxFee, got: " + minimumFee + " > " + maxFee);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (maxPromptLength <= 0) {
            throw new IllegalArgumentException("maxPromptLength must be > 0, got: " + maxPromptLength);
        }
        if (defaultRoyaltyBps < 0 || defaultRoyaltyBps > MAX_ROYALTY_BPS) {
            throw new IllegalArgumentException(
                    "defaultRoyaltyBps must be within 0.." + MAX_ROYALTY_BPS + ", got: " + defaultRoyaltyBps);
        }
    }

    /**
     * Configuration with default fees and limits and no registered chains.
     */
    public static HubConfig defaults(
            final long hubChainId, final Address owner, final Address trustedWorker, final Address gatewayIdentity) {
        return builder()
                .hubChainId(hubChainId)
                .owner(owner)
                .trustedWorker(trustedWorker)
                .gatewayIdentity(gatewayIdentity)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link HubConfig}. Identities and the hub chain id have no defaults.
     */
    public static final class Builder {
        private long hubChainId;
        private @Nullable Address owner;
        private @Nullable Address trustedWorker;
        private @Nullable Address gatewayIdentity;
        private Wei minimumFee = DEFAULT_MINIMUM_FEE;
        private Wei maxFee = DEFAULT_MAX_FEE;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private int maxPromptLength = DEFAULT_MAX_PROMPT_LENGTH;
        private int defaultRoyaltyBps = DEFAULT_ROYALTY_BPS;
        private final List<ChainRegistration> chains = new ArrayList<>();

        private Builder() {}

        public Builder hubChainId(long hubChainId) {
            this.hubChainId = hubChainId;
            return this;
        }

        public Builder owner(Address owner) {
            this.owner = owner;
            return this;
        }

        public Builder trustedWorker(Address trustedWorker) {
            this.trustedWorker = trustedWorker;
            return this;
        }

        public Builder gatewayIdentity(Address gatewayIdentity) {
            this.gatewayIdentity = gatewayIdentity;
            return this;
        }

        public Builder minimumFee(Wei minimumFee) {
            this.minimumFee = minimumFee;
            return this;
        }

        public Builder maxFee(Wei maxFee) {
            this.maxFee = maxFee;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder maxPromptLength(int maxPromptLength) {
            this.maxPromptLength = maxPromptLength;
            return this;
        }

        public Builder defaultRoyaltyBps(int defaultRoyaltyBps) {
            this.defaultRoyaltyBps = defaultRoyaltyBps;
            return this;
        }

        /**
         * Adds a chain registered at start-up.
         */
        public Builder chain(ChainRegistration chain) {
            this.chains.add(Objects.requireNonNull(chain, "chain"));
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         * @throws NullPointerException     if a required value is missing
         */
        public HubConfig build() {
            return new HubConfig(hubChainId, owner, trustedWorker, gatewayIdentity, minimumFee, maxFee,
                    maxRetries, maxPromptLength, defaultRoyaltyBps, chains);
        }
    }
}
