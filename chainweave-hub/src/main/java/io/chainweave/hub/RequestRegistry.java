// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainweave.core.DebugLogger;
import io.chainweave.core.LogSanitizer;
import io.chainweave.core.codec.EnvelopeCodec;
import io.chainweave.core.codec.FailureNotice;
import io.chainweave.core.codec.MintInstruction;
import io.chainweave.core.codec.MintResult;
import io.chainweave.core.crypto.Keccak256;
import io.chainweave.core.error.InvalidTransitionException;
import io.chainweave.core.error.NotFoundException;
import io.chainweave.core.error.RetryLimitExceededException;
import io.chainweave.core.error.UnauthorizedCallerException;
import io.chainweave.core.error.ValidationException;
import io.chainweave.core.types.Address;
import io.chainweave.core.types.HexData;
import io.chainweave.core.types.Page;
import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;
import io.chainweave.gateway.CallContext;
import io.chainweave.gateway.DeliveryHandle;
import io.chainweave.gateway.InboundHandler;
import io.chainweave.gateway.MessagingGateway;

/**
 * The hub: accepts mint requests, escrows their fees and owns the request state machine.
 *
 * <p>Every mutating operation takes the calling account explicitly and checks
 * it against the role the operation requires (requester, trusted worker,
 * gateway identity or owner). Guard failures throw before anything changes, so
 * callers only ever observe fully applied transitions. Counters in
 * {@link PlatformStats} change in the same step as the transition they count.
 *
 * <p>Dispatch is one-way: {@link #dispatchCrossChain} hands a mint instruction
 * to the {@link MessagingGateway} and returns. The request then waits in
 * {@link RequestStatus#CROSS_CHAIN_PENDING} until the minter's result arrives
 * through {@link #onCall}, or the transport reports a revert through
 * {@link #onRevert}. Notices for requests that are not waiting are logged and
 * ignored, which makes redelivered and late notices harmless.
 *
 * <p>The registry itself never times a request out. {@link #stalePending(Duration)}
 * lists dispatches an operator may want to {@link #redispatch}, and
 * {@link #staleProcessing(Duration)} lists generations a worker abandoned.
 *
 * <p><b>Thread Safety:</b> all operations synchronize on the registry.
 */
public final class RequestRegistry implements InboundHandler {

    private static final Logger log = LoggerFactory.getLogger(RequestRegistry.class);

    /** Stored failure reasons are cut to this many characters. */
    public static final int MAX_FAILURE_REASON_LENGTH = 500;

    static final String REVERT_REASON = "cross-chain mint reverted";

    private final HubConfig config;
    private final MessagingGateway gateway;
    private final RequestStore store;
    private final Clock clock;
    private final RegistryListener listener;

    // guarded by this
    private final Map<Long, ChainRegistration> chains = new TreeMap<>();
    private Address trustedWorker;
    private Wei minimumFee;
    private boolean paused;
    private long nonce;
    private long totalRequests;
    private long completedMints;
    private long failedMints;
    private Wei totalFeesCollected = Wei.ZERO;
    private Wei totalFeesRefunded = Wei.ZERO;
    private Wei totalWithdrawn;

    public RequestRegistry(
            final HubConfig config, final MessagingGateway gateway, final RequestStore store, final Clock clock) {
        this(config, gateway, store, clock, RegistryListener.noop());
    }

    /**
     * Creates a registry over {@code store}. Counters are rebuilt from the
     * requests already in the store.
     */
    public RequestRegistry(
            final HubConfig config,
            final MessagingGateway gateway,
            final RequestStore store,
            final Clock clock,
            final RegistryListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.trustedWorker = config.trustedWorker();
        this.minimumFee = config.minimumFee();
        for (final ChainRegistration chain : config.chains()) {
            chains.put(chain.chainId(), chain);
        }
        for (final MintRequest request : store.findAll()) {
            totalRequests++;
            totalFeesCollected = totalFeesCollected.plus(request.fee());
            if (request.status() == RequestStatus.COMPLETED) {
                completedMints++;
            } else if (request.status() == RequestStatus.CANCELLED) {
                totalFeesRefunded = totalFeesRefunded.plus(request.fee());
            } else if (request.status() == RequestStatus.FAILED) {
                failedMints++;
            }
        }
        this.nonce = totalRequests;
        this.totalWithdrawn = store.withdrawnFees();
        if (totalRequests > 0) {
            log.info("Hub on chain {} resumed with {} stored requests", config.hubChainId(), totalRequests);
        }
    }

    // ==================== Submission ====================

    /**
     * Accepts a new request, charging the minimum fee and refunding any excess.
     *
     * @throws ValidationException if paused, the chain is not enabled, the fee is
     *                             too low, or the prompt or recipient is invalid
     */
    public synchronized SubmitReceipt submit(
            final Address caller,
            final String prompt,
            final long destinationChainId,
            final HexData recipient,
            final Wei feePaid) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(feePaid, "feePaid");
        requireNotPaused();
        final ChainRegistration chain = chains.get(destinationChainId);
        if (chain == null || !chain.enabled()) {
            throw new ValidationException("Unsupported chain");
        }
        if (feePaid.isLessThan(minimumFee)) {
            throw new ValidationException("Insufficient fee");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new ValidationException("Empty prompt");
        }
        if (prompt.length() > config.maxPromptLength()) {
            throw new ValidationException("Prompt too long");
        }
        if (recipient == null || recipient.isEmpty()) {
            throw new ValidationException("Empty recipient");
        }

        final RequestId requestId = requestId(caller, prompt, nonce, config.hubChainId());
        if (store.find(requestId).isPresent()) {
            throw new IllegalStateException("request id collision for " + requestId);
        }
        final Wei fee = minimumFee;
        final MintRequest request = MintRequest.pending(
                requestId, caller, prompt, destinationChainId, recipient, fee, clock.instant());
        store.save(request);
        nonce++;
        totalRequests++;
        totalFeesCollected = totalFeesCollected.plus(fee);

        final Wei refund = feePaid.minus(fee);
        log.info("Request {} submitted by {} for chain {} (fee {}, refund {})",
                requestId.shortForm(), caller, destinationChainId, fee, refund);
        DebugLogger.logState("[SUBMIT] id=%s prompt=%s", requestId, LogSanitizer.abbreviate(prompt, 80));
        listener.onSubmitted(request);
        return new SubmitReceipt(requestId, fee, refund);
    }

    /**
     * Request id derivation: keccak256 over the requester's 20 bytes, the UTF-8
     * prompt, then the nonce and hub chain id as 32-byte big-endian words.
     */
    static RequestId requestId(
            final Address requester, final String prompt, final long nonce, final long hubChainId) {
        return RequestId.fromBytes(Keccak256.hash(
                requester.toBytes(),
                prompt.getBytes(StandardCharsets.UTF_8),
                word(nonce),
                word(hubChainId)));
    }

    private static byte[] word(final long value) {
        return ByteBuffer.allocate(32).putLong(24, value).array();
    }

    // ==================== Worker transitions ====================

    public synchronized void markProcessing(final Address caller, final RequestId requestId) {
        requireWorker(caller);
        final MintRequest request = requireRequest(requestId);
        if (request.status() != RequestStatus.PENDING) {
            throw new InvalidTransitionException("mark processing", request.status().name());
        }
        transition(request, request.processing(clock.instant()));
    }

    /**
     * Records the generated metadata URI. Allowed once, from PENDING or PROCESSING;
     * a second call is rejected. Use {@link #updateRequestMetadata} to replace the
     * URI before dispatch.
     */
    public synchronized void completeGeneration(
            final Address caller, final RequestId requestId, final String tokenUri) {
        requireWorker(caller);
        final MintRequest request = requireRequest(requestId);
        if (!request.status().isPreGeneration()) {
            throw new InvalidTransitionException("complete generation", request.status().name());
        }
        requireUri(tokenUri);
        transition(request, request.generated(tokenUri, clock.instant()));
    }

    /**
     * Records that generation failed. The requester may {@link #retry}.
     */
    public synchronized void failGeneration(final Address caller, final RequestId requestId, final String reason) {
        requireWorker(caller);
        final MintRequest request = requireRequest(requestId);
        if (!request.status().isPreGeneration()) {
            throw new InvalidTransitionException("fail generation", request.status().name());
        }
        transition(request, request.failed(truncateReason(reason), clock.instant()));
    }

    /**
     * Replaces the metadata URI of a generated request that has not been dispatched yet.
     */
    public synchronized void updateRequestMetadata(
            final Address caller, final RequestId requestId, final String tokenUri) {
        requireWorker(caller);
        final MintRequest request = requireRequest(requestId);
        if (request.status() != RequestStatus.AI_COMPLETED) {
            throw new InvalidTransitionException("update metadata of", request.status().name());
        }
        requireUri(tokenUri);
        store.save(request.withTokenUri(tokenUri, clock.instant()));
        DebugLogger.logState("[METADATA] id=%s uri=%s", requestId, LogSanitizer.abbreviate(tokenUri, 120));
    }

    // ==================== Dispatch ====================

    /**
     * Sends the mint instruction for a generated request and moves it to
     * CROSS_CHAIN_PENDING. Returns once the gateway has accepted the message. If
     * the gateway throws, the request is left unchanged.
     *
     * @throws UnauthorizedCallerException if the caller is neither the trusted worker nor the owner
     */
    public synchronized DeliveryHandle dispatchCrossChain(final Address caller, final RequestId requestId) {
        if (!caller.equals(trustedWorker) && !caller.equals(config.owner())) {
            throw new UnauthorizedCallerException(caller, "the trusted worker or owner");
        }
        final MintRequest request = requireRequest(requestId);
        if (request.status() != RequestStatus.AI_COMPLETED) {
            throw new InvalidTransitionException("dispatch", request.status().name());
        }
        final DeliveryHandle handle = send(request);
        transition(request, request.dispatched(handle.id(), clock.instant()));
        return handle;
    }

    /**
     * Re-sends the identical mint instruction for a request still waiting in
     * CROSS_CHAIN_PENDING. Owner only. Minters are idempotent, so a request that
     * did mint comes back as a duplicate failure carrying the existing token.
     */
    public synchronized DeliveryHandle redispatch(final Address caller, final RequestId requestId) {
        requireOwner(caller);
        final MintRequest request = requireRequest(requestId);
        if (request.status() != RequestStatus.CROSS_CHAIN_PENDING) {
            throw new InvalidTransitionException("redispatch", request.status().name());
        }
        final DeliveryHandle handle = send(request);
        store.save(request.dispatched(handle.id(), clock.instant()));
        log.warn("Request {} redispatched as message {}", requestId.shortForm(), handle.id());
        return handle;
    }

    private DeliveryHandle send(final MintRequest request) {
        final ChainRegistration chain = chains.get(request.destinationChainId());
        if (chain == null) {
            throw new ValidationException("Unsupported chain");
        }
        final byte[] payload = EnvelopeCodec.encodeMintInstruction(new MintInstruction(
                request.requestId(), request.recipient(), request.tokenUri(), config.defaultRoyaltyBps()));
        final byte[] revertPayload =
                EnvelopeCodec.encodeFailureNotice(new FailureNotice(request.requestId(), REVERT_REASON));
        final DeliveryHandle handle =
                gateway.send(chain.chainId(), chain.minterEndpoint(), payload, revertPayload);
        log.info("Request {} dispatched to chain {} as message {}",
                request.requestId().shortForm(), chain.chainId(), handle.id());
        listener.onDispatched(request.requestId(), handle);
        return handle;
    }

    // ==================== Gateway notices ====================

    /**
     * Completes a request the minter reported as minted.
     *
     * @return false if the request was not waiting for a result; nothing changes then
     */
    public synchronized boolean onMintSuccess(final Address caller, final RequestId requestId, final long tokenId) {
        requireGateway(caller);
        final MintRequest request = requireRequest(requestId);
        if (request.status() != RequestStatus.CROSS_CHAIN_PENDING) {
            return ignoreNotice(request, "success");
        }
        if (tokenId <= 0) {
            throw new ValidationException("Invalid token id " + tokenId);
        }
        transition(request, request.completed(tokenId, clock.instant()));
        completedMints++;
        log.info("Request {} completed as token {} on chain {}",
                requestId.shortForm(), tokenId, request.destinationChainId());
        return true;
    }

    /**
     * Fails a request the minter could not fulfil. The requester may {@link #retry}.
     *
     * @return false if the request was not waiting for a result; nothing changes then
     */
    public synchronized boolean onMintFailure(final Address caller, final RequestId requestId, final String reason) {
        requireGateway(caller);
        final MintRequest request = requireRequest(requestId);
        if (request.status() != RequestStatus.CROSS_CHAIN_PENDING) {
            return ignoreNotice(request, "failure");
        }
        final String stored = truncateReason(reason);
        transition(request, request.failed(stored, clock.instant()));
        failedMints++;
        log.warn("Request {} failed on chain {}: {}",
                requestId.shortForm(), request.destinationChainId(), LogSanitizer.abbreviate(stored, 200));
        return true;
    }

    private boolean ignoreNotice(final MintRequest request, final String kind) {
        log.info("Ignoring mint {} notice for request {} in state {}",
                kind, request.requestId().shortForm(), request.status());
        listener.onNoticeIgnored(request.requestId(), request.status());
        return false;
    }

    /**
     * Handles a {@link MintResult} from a minter. The result must come from the
     * endpoint registered for the request's destination chain. A failure that
     * carries a token id reports a duplicate instruction and completes the request.
     */
    @Override
    public synchronized void onCall(final Address caller, final CallContext context, final byte[] payload) {
        requireGateway(caller);
        final MintResult result = EnvelopeCodec.decodeMintResult(payload);
        final MintRequest request = requireRequest(result.requestId());
        final ChainRegistration chain = chains.get(request.destinationChainId());
        if (chain == null
                || context.sourceChainId() != chain.chainId()
                || !context.sourceEndpoint().equals(chain.minterEndpoint())) {
            throw new UnauthorizedCallerException(
                    context.sourceEndpoint(), "the minter for chain " + request.destinationChainId());
        }
        if (result.success()) {
            onMintSuccess(caller, result.requestId(), result.tokenId());
        } else if (result.tokenId() > 0) {
            // duplicate instruction: the token already exists
            log.info("Request {} was already minted as token {}", result.requestId().shortForm(), result.tokenId());
            onMintSuccess(caller, result.requestId(), result.tokenId());
        } else {
            onMintFailure(caller, result.requestId(), result.reason());
        }
    }

    /**
     * Handles the revert of a mint instruction this hub sent.
     */
    @Override
    public synchronized void onRevert(final Address caller, final CallContext context, final byte[] payload) {
        requireGateway(caller);
        final FailureNotice notice = EnvelopeCodec.decodeFailureNotice(payload);
        onMintFailure(caller, notice.requestId(), notice.reason());
    }

    // ==================== Requester actions ====================

    /**
     * Cancels a request whose generation has not finished.
     *
     * @return the refunded fee, exactly the escrowed amount
     */
    public synchronized Wei cancel(final Address caller, final RequestId requestId) {
        final MintRequest request = requireRequest(requestId);
        requireRequester(caller, request);
        if (!request.status().isPreGeneration()) {
            throw new InvalidTransitionException("cancel", request.status().name());
        }
        transition(request, request.cancelled(clock.instant()));
        totalFeesRefunded = totalFeesRefunded.plus(request.fee());
        log.info("Request {} cancelled, refunding {}", requestId.shortForm(), request.fee());
        return request.fee();
    }

    /**
     * Sends a failed request back to PENDING without a new fee.
     *
     * @throws RetryLimitExceededException once the retry limit is used up
     */
    public synchronized void retry(final Address caller, final RequestId requestId) {
        final MintRequest request = requireRequest(requestId);
        requireRequester(caller, request);
        if (request.status() != RequestStatus.FAILED) {
            throw new InvalidTransitionException("retry", request.status().name());
        }
        if (request.retryCount() >= config.maxRetries()) {
            throw new RetryLimitExceededException(requestId, request.retryCount());
        }
        transition(request, request.retried(clock.instant()));
        log.info("Request {} retry {} of {}", requestId.shortForm(), request.retryCount() + 1, config.maxRetries());
    }

    // ==================== Administration ====================

    /**
     * Registers or replaces a destination chain and enables it.
     */
    public synchronized void registerChain(final Address caller, final long chainId, final Address minterEndpoint) {
        requireOwner(caller);
        if (minterEndpoint == null || minterEndpoint.isZero()) {
            throw new ValidationException("Invalid address");
        }
        if (chainId <= 0) {
            throw new ValidationException("Invalid chain id " + chainId);
        }
        chains.put(chainId, new ChainRegistration(chainId, minterEndpoint, true));
        log.info("Chain {} registered with minter {}", chainId, minterEndpoint);
    }

    /**
     * Disables a chain for new requests. Requests already accepted for it still dispatch.
     */
    public synchronized void unregisterChain(final Address caller, final long chainId) {
        requireOwner(caller);
        final ChainRegistration chain = chains.get(chainId);
        if (chain == null) {
            throw new NotFoundException("Chain " + chainId + " is not registered");
        }
        chains.put(chainId, chain.disabled());
        log.info("Chain {} disabled", chainId);
    }

    public synchronized void setMinimumFee(final Address caller, final Wei fee) {
        requireOwner(caller);
        Objects.requireNonNull(fee, "fee");
        if (config.maxFee().isLessThan(fee)) {
            throw new ValidationException("Fee too high");
        }
        log.info("Minimum fee changed from {} to {}", minimumFee, fee);
        minimumFee = fee;
    }

    public synchronized void setTrustedWorker(final Address caller, final Address worker) {
        requireOwner(caller);
        if (worker == null || worker.isZero()) {
            throw new ValidationException("Invalid address");
        }
        trustedWorker = worker;
        log.info("Trusted worker set to {}", worker);
    }

    public synchronized void pause(final Address caller) {
        requireOwner(caller);
        paused = true;
        log.info("Hub paused");
    }

    public synchronized void unpause(final Address caller) {
        requireOwner(caller);
        paused = false;
        log.info("Hub unpaused");
    }

    /**
     * Pays out every fee that can no longer be refunded and was not withdrawn
     * before. A request's fee stays in escrow until the request is terminal,
     * because a failed request may be retried and then cancelled.
     *
     * @return the amount withdrawn, possibly zero
     */
    public synchronized Wei withdrawFees(final Address caller) {
        requireOwner(caller);
        final Wei amount = withdrawableFees();
        store.saveWithdrawnFees(totalWithdrawn.plus(amount));
        totalWithdrawn = totalWithdrawn.plus(amount);
        log.info("Withdrew {} in fees", amount);
        listener.onFeesWithdrawn(amount);
        return amount;
    }

    /**
     * Fees collected minus refunds, earlier withdrawals and the escrow of
     * requests that are not settled yet.
     */
    public synchronized Wei withdrawableFees() {
        Wei escrowed = Wei.ZERO;
        for (final MintRequest request : store.findAll()) {
            if (!isSettled(request)) {
                escrowed = escrowed.plus(request.fee());
            }
        }
        return totalFeesCollected.minus(totalFeesRefunded).minus(totalWithdrawn).minus(escrowed);
    }

    /**
     * Whether {@code request} can no longer move: terminal, or FAILED with every
     * retry used. A settled request's fee is no longer escrowed.
     */
    private boolean isSettled(final MintRequest request) {
        if (request.status().isTerminal()) {
            return true;
        }
        return request.status() == RequestStatus.FAILED && request.retryCount() >= config.maxRetries();
    }

    // ==================== Queries ====================

    public synchronized Optional<MintRequest> getRequest(final RequestId requestId) {
        return store.find(requestId);
    }

    /**
     * Requests in {@code status}, in submission order.
     */
    public synchronized Page<MintRequest> requestsByStatus(
            final RequestStatus status, final int offset, final int limit) {
        final List<MintRequest> matching = new ArrayList<>();
        for (final MintRequest request : store.findAll()) {
            if (request.status() == status) {
                matching.add(request);
            }
        }
        return Page.of(matching, offset, limit);
    }

    /**
     * Requests submitted by {@code requester}, in submission order.
     */
    public synchronized Page<MintRequest> requestsByRequester(
            final Address requester, final int offset, final int limit) {
        final List<MintRequest> matching = new ArrayList<>();
        for (final MintRequest request : store.findAll()) {
            if (request.requester().equals(requester)) {
                matching.add(request);
            }
        }
        return Page.of(matching, offset, limit);
    }

    /**
     * Requests still in CROSS_CHAIN_PENDING whose last dispatch is older than {@code maxAge}.
     */
    public synchronized List<MintRequest> stalePending(final Duration maxAge) {
        final Instant cutoff = clock.instant().minus(maxAge);
        final List<MintRequest> stale = new ArrayList<>();
        for (final MintRequest request : store.findAll()) {
            if (request.status() == RequestStatus.CROSS_CHAIN_PENDING && request.updatedAt().isBefore(cutoff)) {
                stale.add(request);
            }
        }
        return stale;
    }

    /**
     * Requests still in PROCESSING that have not moved for longer than {@code maxAge},
     * typically left behind by a worker that stopped mid-generation.
     */
    public synchronized List<MintRequest> staleProcessing(final Duration maxAge) {
        final Instant cutoff = clock.instant().minus(maxAge);
        final List<MintRequest> stale = new ArrayList<>();
        for (final MintRequest request : store.findAll()) {
            if (request.status() == RequestStatus.PROCESSING && request.updatedAt().isBefore(cutoff)) {
                stale.add(request);
            }
        }
        return stale;
    }

    public synchronized PlatformStats stats() {
        int activeChains = 0;
        for (final ChainRegistration chain : chains.values()) {
            if (chain.enabled()) {
                activeChains++;
            }
        }
        return new PlatformStats(totalRequests, completedMints, totalFeesCollected, activeChains,
                totalFeesRefunded, failedMints);
    }

    public synchronized Optional<ChainRegistration> chain(final long chainId) {
        return Optional.ofNullable(chains.get(chainId));
    }

    public synchronized List<ChainRegistration> chains() {
        return List.copyOf(chains.values());
    }

    public synchronized Wei minimumFee() {
        return minimumFee;
    }

    public synchronized Address trustedWorker() {
        return trustedWorker;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public long hubChainId() {
        return config.hubChainId();
    }

    // ==================== Guards ====================

    private void transition(final MintRequest from, final MintRequest to) {
        store.save(to);
        DebugLogger.logState("[TRANSITION] id=%s %s -> %s", from.requestId(), from.status(), to.status());
        listener.onStatusChanged(from.requestId(), from.status(), to.status());
    }

    private MintRequest requireRequest(final RequestId requestId) {
        Objects.requireNonNull(requestId, "requestId");
        return store.find(requestId)
                .orElseThrow(() -> new NotFoundException("Request " + requestId + " not found"));
    }

    private void requireWorker(final Address caller) {
        if (!trustedWorker.equals(caller)) {
            throw new UnauthorizedCallerException(caller, "the trusted worker");
        }
    }

    private void requireGateway(final Address caller) {
        if (!config.gatewayIdentity().equals(caller)) {
            throw new UnauthorizedCallerException(caller, "the hub gateway");
        }
    }

    private void requireOwner(final Address caller) {
        if (!config.owner().equals(caller)) {
            throw new UnauthorizedCallerException(caller, "the hub owner");
        }
    }

    private static void requireRequester(final Address caller, final MintRequest request) {
        if (!request.requester().equals(caller)) {
            throw new UnauthorizedCallerException(caller, "the requester");
        }
    }

    private void requireNotPaused() {
        if (paused) {
            throw new ValidationException("Hub is paused");
        }
    }

    private static void requireUri(final String tokenUri) {
        if (tokenUri == null || tokenUri.isBlank()) {
            throw new ValidationException("Empty token URI");
        }
    }

    private static String truncateReason(final String reason) {
        final String value = reason == null ? "" : reason;
        return value.length() <= MAX_FAILURE_REASON_LENGTH ? value : value.substring(0, MAX_FAILURE_REASON_LENGTH);
    }
}
