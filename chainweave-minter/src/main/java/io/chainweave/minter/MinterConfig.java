// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.chainweave.core.types.Address;

/**
 * Initial configuration of a {@link DestinationMinter}.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * MinterConfig config = MinterConfig.builder()
 *     .chainId(137)
 *     .owner(admin)
 *     .gatewayIdentity(gateway.identity())
 *     .trustedHub(hubEndpoint)
 *     .build();
 * }</pre>
 *
 * @param chainId           chain the minter issues tokens on
 * @param owner             administrator allowed to pause and reconfigure
 * @param gatewayIdentity   identity of the gateway adapter that forwards mint instructions
 * @param trustedHub        hub endpoint allowed to originate instructions, or {@code null} to accept any
 * @param defaultRoyaltyBps royalty applied by {@link DestinationMinter#mint(Address, io.chainweave.core.types.RequestId,
 *                          Address, String)} (0..{@value #MAX_ROYALTY_BPS})
 */
public record MinterConfig(
        long chainId,
        Address owner,
        Address gatewayIdentity,
        @Nullable Address trustedHub,
        int defaultRoyaltyBps) {

    /** Upper bound for any royalty, in basis points (10%). */
    public static final int MAX_ROYALTY_BPS = 1000;

    /** Default royalty: 500 bps (5%). */
    public static final int DEFAULT_ROYALTY_BPS = 500;

    public MinterConfig {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(gatewayIdentity, "gatewayIdentity");
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be > 0, got: " + chainId);
        }
        if (owner.isZero() || gatewayIdentity.isZero()) {
            throw new IllegalArgumentException("owner and gatewayIdentity must be non-zero");
        }
        if (trustedHub != null && trustedHub.isZero()) {
            throw new IllegalArgumentException("trustedHub must be non-zero when set");
        }
        if (defaultRoyaltyBps < 0 || defaultRoyaltyBps > MAX_ROYALTY_BPS) {
            throw new IllegalArgumentException(
                    "defaultRoyaltyBps must be within 0.." + MAX_ROYALTY_BPS + ", got: " + defaultRoyaltyBps);
        }
    }

    /**
     * Configuration with the default royalty and no hub restriction.
     */
    public static MinterConfig defaults(final long chainId, final Address owner, final Address gatewayIdentity) {
        return new MinterConfig(chainId, owner, gatewayIdentity, null, DEFAULT_ROYALTY_BPS);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link MinterConfig}. {@code chainId}, {@code owner} and
     * {@code gatewayIdentity} have no defaults.
     */
    public static final class Builder {
        private long chainId;
        private @Nullable Address owner;
        private @Nullable Address gatewayIdentity;
        private @Nullable Address trustedHub;
        private int defaultRoyaltyBps = DEFAULT_ROYALTY_BPS;

        private Builder() {}

        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder owner(Address owner) {
            this.owner = owner;
            return this;
        }

        public Builder gatewayIdentity(Address gatewayIdentity) {
            this.gatewayIdentity = gatewayIdentity;
            return this;
        }

        public Builder trustedHub(@Nullable Address trustedHub) {
            this.trustedHub = trustedHub;
            return this;
        }

        public Builder defaultRoyaltyBps(int defaultRoyaltyBps) {
            this.defaultRoyaltyBps = defaultRoyaltyBps;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         * @throws NullPointerException     if a required value is missing
         */
        public MinterConfig build() {
            return new MinterConfig(chainId, owner, gatewayIdentity, trustedHub, defaultRoyaltyBps);
        }
    }
}
