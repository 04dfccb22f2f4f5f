// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainweave.core.DebugLogger;
import io.chainweave.core.LogSanitizer;
import io.chainweave.core.codec.EnvelopeCodec;
import io.chainweave.core.codec.FailureNotice;
import io.chainweave.core.codec.MintInstruction;
import io.chainweave.core.codec.MintResult;
import io.chainweave.core.error.DuplicateRequestException;
import io.chainweave.core.error.NotFoundException;
import io.chainweave.core.error.UnauthorizedCallerException;
import io.chainweave.core.error.ValidationException;
import io.chainweave.core.types.Address;
import io.chainweave.core.types.HexData;
import io.chainweave.core.types.Page;
import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;
import io.chainweave.gateway.CallContext;
import io.chainweave.gateway.InboundHandler;
import io.chainweave.gateway.MessagingGateway;

/**
 * Per-chain component that issues tokens on instruction from the hub.
 *
 * <p>Every mint is keyed by the hub's request id. The processed-id check, its
 * insertion and token creation happen in one synchronized step, so an
 * instruction delivered more than once produces exactly one token; later
 * deliveries fail with {@link DuplicateRequestException}, even while paused.
 *
 * <p>Tokens live in the {@link ProcessedRequestStore}; the minter holds only
 * its administrative settings. Token ids continue from the store's highest id,
 * so a minter reopened over a durable store never reissues an id.
 *
 * <p>As an {@link InboundHandler}, the minter decodes mint instructions arriving
 * through its gateway and always answers the originating hub with a
 * {@link MintResult}: success with the token id, or failure with the reason. A
 * payload that cannot be decoded is not answered; the exception propagates so
 * the transport reverts the message and the hub receives its failure notice.
 *
 * <p><b>Thread Safety:</b> all operations synchronize on the minter.
 */
public final class DestinationMinter implements InboundHandler {

    private static final Logger log = LoggerFactory.getLogger(DestinationMinter.class);

    private static final int BPS_DENOMINATOR = 10_000;
    private static final int PADDED_ADDRESS_LENGTH = 32;
    private static final int ADDRESS_LENGTH = 20;

    private final MinterConfig config;
    private final MessagingGateway gateway;
    private final ProcessedRequestStore store;
    private final Clock clock;

    // guarded by this
    private int defaultRoyaltyBps;
    private @Nullable Address collectionRoyaltyReceiver;
    private int collectionRoyaltyBps;
    private @Nullable Address trustedHub;
    private boolean paused;

    public DestinationMinter(
            final MinterConfig config,
            final MessagingGateway gateway,
            final ProcessedRequestStore store,
            final Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultRoyaltyBps = config.defaultRoyaltyBps();
        this.trustedHub = config.trustedHub();
        final long lastTokenId = store.maxTokenId();
        if (lastTokenId > 0) {
            log.info("Minter on chain {} resuming after token {}", config.chainId(), lastTokenId);
        }
    }

    // ==================== Minting ====================

    /**
     * Mints with the current default royalty.
     *
     * @see #mint(Address, RequestId, Address, String, int)
     */
    public synchronized long mint(
            final Address caller, final RequestId requestId, final Address recipient, final String tokenUri) {
        return mint(caller, requestId, recipient, tokenUri, defaultRoyaltyBps);
    }

    /**
     * Mints the token for {@code requestId}.
     *
     * @return the new token id
     * @throws UnauthorizedCallerException if the caller is neither the gateway nor the trusted hub
     * @throws DuplicateRequestException   if the request was already fulfilled, whether or not paused
     * @throws ValidationException         if paused, or the recipient, URI or royalty is invalid
     */
    public synchronized long mint(
            final Address caller,
            final RequestId requestId,
            final Address recipient,
            final String tokenUri,
            final int royaltyBps) {
        Objects.requireNonNull(requestId, "requestId");
        if (!caller.equals(config.gatewayIdentity()) && !caller.equals(trustedHub)) {
            throw new UnauthorizedCallerException(caller, "the gateway or trusted hub");
        }
        final OptionalLong existing = store.tokenFor(requestId);
        if (existing.isPresent()) {
            throw new DuplicateRequestException(requestId, existing.getAsLong());
        }
        requireNotPaused();
        if (recipient == null || recipient.isZero()) {
            throw new ValidationException("Invalid recipient");
        }
        requireUri(tokenUri);
        requireRoyalty(royaltyBps);

        final long tokenId = store.maxTokenId() + 1;
        final MintedToken token = new MintedToken(
                tokenId, recipient, tokenUri, royaltyBps, requestId, clock.instant(), null);
        if (!store.markProcessed(token)) {
            throw new DuplicateRequestException(requestId, store.tokenFor(requestId).orElse(0L));
        }

        log.info("Minted token {} for request {} to {} on chain {}",
                tokenId, requestId.shortForm(), recipient, config.chainId());
        DebugLogger.logState("[MINT] chain=%d token=%d request=%s uri=%s",
                config.chainId(), tokenId, requestId, LogSanitizer.abbreviate(tokenUri, 120));
        return tokenId;
    }

    // ==================== Inbound messages ====================

    @Override
    public void onCall(final Address caller, final CallContext context, final byte[] payload) {
        if (!caller.equals(config.gatewayIdentity())) {
            throw new UnauthorizedCallerException(caller, "the minter gateway");
        }
        final MintInstruction instruction = EnvelopeCodec.decodeMintInstruction(payload);
        final Address hub = trustedHub();
        if (hub != null && !hub.equals(context.sourceEndpoint())) {
            throw new UnauthorizedCallerException(context.sourceEndpoint(), "the trusted hub");
        }

        final RequestId requestId = instruction.requestId();
        MintResult result;
        try {
            final long tokenId = mint(caller, requestId, recipientOf(instruction.recipient()),
                    instruction.tokenUri(), instruction.royaltyBps());
            result = MintResult.success(requestId, tokenId);
        } catch (DuplicateRequestException e) {
            log.warn("Duplicate mint instruction for request {} (token {})",
                    requestId.shortForm(), e.existingTokenId());
            result = MintResult.failure(requestId, e.existingTokenId(), e.getMessage());
        } catch (ValidationException e) {
            log.warn("Rejected mint instruction for request {}: {}", requestId.shortForm(), e.getMessage());
            result = MintResult.failure(requestId, e.getMessage());
        }
        gateway.send(context.sourceChainId(), context.sourceEndpoint(), EnvelopeCodec.encodeMintResult(result));
    }

    @Override
    public void onRevert(final Address caller, final CallContext context, final byte[] payload) {
        if (!caller.equals(config.gatewayIdentity())) {
            throw new UnauthorizedCallerException(caller, "the minter gateway");
        }
        final FailureNotice notice = EnvelopeCodec.decodeFailureNotice(payload);
        log.warn("Result for request {} was not delivered to chain {}: {}",
                notice.requestId().shortForm(), context.sourceChainId(), notice.reason());
    }

    /**
     * Accepts a 20-byte address or a 32-byte word holding a left-padded address.
     */
    static Address recipientOf(final HexData encoded) {
        final byte[] raw = encoded.toBytes();
        if (raw.length == ADDRESS_LENGTH) {
            return Address.fromBytes(raw);
        }
        if (raw.length == PADDED_ADDRESS_LENGTH) {
            for (int i = 0; i < PADDED_ADDRESS_LENGTH - ADDRESS_LENGTH; i++) {
                if (raw[i] != 0) {
                    throw new ValidationException("Invalid recipient");
                }
            }
            final byte[] address = new byte[ADDRESS_LENGTH];
            System.arraycopy(raw, PADDED_ADDRESS_LENGTH - ADDRESS_LENGTH, address, 0, ADDRESS_LENGTH);
            return Address.fromBytes(address);
        }
        throw new ValidationException("Invalid recipient");
    }

    // ==================== Token operations ====================

    /**
     * Replaces a token's metadata URI. Owner or approved delegate only.
     */
    public synchronized void updateTokenMetadata(final Address caller, final long tokenId, final String tokenUri) {
        final MintedToken token = requireToken(tokenId);
        if (!token.isOwnerOrApproved(caller)) {
            throw new UnauthorizedCallerException(caller, "owner or approved for token " + tokenId);
        }
        requireUri(tokenUri);
        store.update(List.of(token.withTokenUri(tokenUri)), 0);
        DebugLogger.logState("[METADATA] token=%d uri=%s", tokenId, LogSanitizer.abbreviate(tokenUri, 120));
    }

    /**
     * Sets a per-token royalty. Token owner only.
     */
    public synchronized void setRoyalty(final Address caller, final long tokenId, final int royaltyBps) {
        final MintedToken token = requireToken(tokenId);
        if (!token.owner().equals(caller)) {
            throw new UnauthorizedCallerException(caller, "owner of token " + tokenId);
        }
        requireRoyalty(royaltyBps);
        store.update(List.of(token.withRoyaltyBps(royaltyBps)), 0);
    }

    /**
     * Lets {@code delegate} transfer or update the token; {@link Address#ZERO} clears the approval.
     */
    public synchronized void approve(final Address caller, final long tokenId, final Address delegate) {
        final MintedToken token = requireToken(tokenId);
        if (!token.owner().equals(caller)) {
            throw new UnauthorizedCallerException(caller, "owner of token " + tokenId);
        }
        if (token.owner().equals(delegate)) {
            throw new ValidationException("Approval to current owner");
        }
        store.update(List.of(token.withApproved(delegate.isZero() ? null : delegate)), 0);
    }

    /**
     * Transfers {@code tokenIds[i]} to {@code recipients[i]}. Either every
     * transfer is applied or none is.
     */
    public synchronized void transferBatch(
            final Address caller, final List<Address> recipients, final List<Long> tokenIds) {
        Objects.requireNonNull(recipients, "recipients");
        Objects.requireNonNull(tokenIds, "tokenIds");
        requireNotPaused();
        if (recipients.size() != tokenIds.size()) {
            throw new ValidationException("Array length mismatch");
        }
        if (tokenIds.isEmpty()) {
            throw new ValidationException("Empty batch");
        }
        final Set<Long> seen = new HashSet<>();
        final List<MintedToken> moved = new ArrayList<>(tokenIds.size());
        for (int i = 0; i < tokenIds.size(); i++) {
            final long tokenId = tokenIds.get(i);
            final Address recipient = recipients.get(i);
            if (!seen.add(tokenId)) {
                throw new ValidationException("Token " + tokenId + " appears twice in batch");
            }
            if (recipient == null || recipient.isZero()) {
                throw new ValidationException("Invalid recipient");
            }
            final MintedToken token = requireToken(tokenId);
            if (!token.isOwnerOrApproved(caller)) {
                throw new UnauthorizedCallerException(caller, "owner or approved for token " + tokenId);
            }
            moved.add(token.withOwner(recipient));
        }
        store.update(moved, moved.size());
        log.info("Batch transferred {} tokens on chain {}", moved.size(), config.chainId());
    }

    /**
     * Royalty owed to the current owner on a sale of {@code salePrice}.
     */
    public synchronized RoyaltyInfo royaltyInfo(final long tokenId, final Wei salePrice) {
        final MintedToken token = requireToken(tokenId);
        return new RoyaltyInfo(token.owner(), royaltyOf(salePrice, token.royaltyBps()));
    }

    private static Wei royaltyOf(final Wei salePrice, final int royaltyBps) {
        return Wei.of(salePrice.value()
                .multiply(BigInteger.valueOf(royaltyBps))
                .divide(BigInteger.valueOf(BPS_DENOMINATOR)));
    }

    // ==================== Administration ====================

    public synchronized void setDefaultRoyalty(final Address caller, final int royaltyBps) {
        requireOwner(caller);
        requireRoyalty(royaltyBps);
        defaultRoyaltyBps = royaltyBps;
    }

    /**
     * Sets the collection-wide royalty: {@code receiver} is paid {@code royaltyBps}
     * on sales of the collection as a whole. Per-token royalties are unaffected.
     */
    public synchronized void setCollectionRoyalty(final Address caller, final Address receiver, final int royaltyBps) {
        requireOwner(caller);
        if (receiver == null || receiver.isZero()) {
            throw new ValidationException("Invalid address");
        }
        requireRoyalty(royaltyBps);
        collectionRoyaltyReceiver = receiver;
        collectionRoyaltyBps = royaltyBps;
        log.info("Collection royalty on chain {} set to {} bps for {}", config.chainId(), royaltyBps, receiver);
    }

    /**
     * Collection royalty owed on a sale of {@code salePrice}, empty until
     * {@link #setCollectionRoyalty} has been called.
     */
    public synchronized Optional<RoyaltyInfo> collectionRoyaltyInfo(final Wei salePrice) {
        final Address receiver = collectionRoyaltyReceiver;
        if (receiver == null) {
            return Optional.empty();
        }
        return Optional.of(new RoyaltyInfo(receiver, royaltyOf(salePrice, collectionRoyaltyBps)));
    }

    public synchronized void setTrustedHub(final Address caller, final Address hub) {
        requireOwner(caller);
        if (hub == null || hub.isZero()) {
            throw new ValidationException("Invalid address");
        }
        trustedHub = hub;
        log.info("Trusted hub on chain {} set to {}", config.chainId(), hub);
    }

    public synchronized void pause(final Address caller) {
        requireOwner(caller);
        paused = true;
        log.info("Minter on chain {} paused", config.chainId());
    }

    public synchronized void unpause(final Address caller) {
        requireOwner(caller);
        paused = false;
        log.info("Minter on chain {} unpaused", config.chainId());
    }

    // ==================== Queries ====================

    public synchronized Optional<MintedToken> token(final long tokenId) {
        return store.token(tokenId);
    }

    public synchronized Optional<MintedToken> tokenByRequest(final RequestId requestId) {
        final OptionalLong tokenId = store.tokenFor(requestId);
        return tokenId.isPresent() ? store.token(tokenId.getAsLong()) : Optional.empty();
    }

    public boolean isRequestProcessed(final RequestId requestId) {
        return store.isProcessed(requestId);
    }

    /**
     * Tokens held by {@code owner}, ascending by token id.
     */
    public synchronized Page<MintedToken> tokensByOwner(final Address owner, final int offset, final int limit) {
        final List<MintedToken> owned = new ArrayList<>();
        for (final MintedToken token : store.tokens()) {
            if (token.owner().equals(owner)) {
                owned.add(token);
            }
        }
        return Page.of(owned, offset, limit);
    }

    /**
     * Tokens for the given ids, in the order requested.
     *
     * @throws NotFoundException if any id is unknown
     */
    public synchronized List<MintedToken> tokenMetadataBatch(final List<Long> tokenIds) {
        final List<MintedToken> result = new ArrayList<>(tokenIds.size());
        for (final long tokenId : tokenIds) {
            result.add(requireToken(tokenId));
        }
        return List.copyOf(result);
    }

    public synchronized CollectionStats collectionStats() {
        final List<MintedToken> tokens = store.tokens();
        final Set<Address> owners = new HashSet<>();
        for (final MintedToken token : tokens) {
            owners.add(token.owner());
        }
        return new CollectionStats(tokens.size(), store.maxTokenId(), owners.size(), store.totalVolume());
    }

    public synchronized int defaultRoyaltyBps() {
        return defaultRoyaltyBps;
    }

    public synchronized @Nullable Address trustedHub() {
        return trustedHub;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public long chainId() {
        return config.chainId();
    }

    // ==================== Guards ====================

    private MintedToken requireToken(final long tokenId) {
        return store.token(tokenId)
                .orElseThrow(() -> new NotFoundException("Token " + tokenId + " does not exist"));
    }

    private void requireOwner(final Address caller) {
        if (!config.owner().equals(caller)) {
            throw new UnauthorizedCallerException(caller, "the minter owner");
        }
    }

    private void requireNotPaused() {
        if (paused) {
            throw new ValidationException("Minter is paused");
        }
    }

    private static void requireUri(final String tokenUri) {
        if (tokenUri == null || tokenUri.isBlank()) {
            throw new ValidationException("Empty token URI");
        }
    }

    private static void requireRoyalty(final int royaltyBps) {
        if (royaltyBps < 0 || royaltyBps > MinterConfig.MAX_ROYALTY_BPS) {
            throw new ValidationException("Royalty too high");
        }
    }
}
