// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import static io.chainweave.hub.RequestRegistryTest.FEE;
import static io.chainweave.hub.RequestRegistryTest.GATEWAY;
import static io.chainweave.hub.RequestRegistryTest.MINTER;
import static io.chainweave.hub.RequestRegistryTest.OWNER;
import static io.chainweave.hub.RequestRegistryTest.POLYGON;
import static io.chainweave.hub.RequestRegistryTest.PROMPT;
import static io.chainweave.hub.RequestRegistryTest.RECIPIENT;
import static io.chainweave.hub.RequestRegistryTest.SEPOLIA;
import static io.chainweave.hub.RequestRegistryTest.STRANGER;
import static io.chainweave.hub.RequestRegistryTest.URI;
import static io.chainweave.hub.RequestRegistryTest.USER1;
import static io.chainweave.hub.RequestRegistryTest.USER2;
import static io.chainweave.hub.RequestRegistryTest.WORKER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.chainweave.core.error.NotFoundException;
import io.chainweave.core.error.RetryLimitExceededException;
import io.chainweave.core.error.UnauthorizedCallerException;
import io.chainweave.core.error.ValidationException;
import io.chainweave.core.types.Address;
import io.chainweave.core.types.Page;
import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;
import io.chainweave.gateway.DeliveryHandle;
import io.chainweave.gateway.MessagingGateway;

/**
 * Administration, fee accounting and queries of {@link RequestRegistry}.
 */
@ExtendWith(MockitoExtension.class)
class RequestRegistryAdminTest {

    @Mock
    private MessagingGateway gateway;

    @Mock
    private DeliveryHandle handle;

    private InMemoryRequestStore store;
    private MutableClock clock;
    private RequestRegistry registry;
    private final List<Wei> withdrawals = new ArrayList<>();

    @BeforeEach
    void setUp() {
        lenient().when(gateway.send(anyLong(), any(Address.class), any(byte[].class), any(byte[].class)))
                .thenReturn(handle);
        lenient().when(handle.id()).thenReturn("msg-1");
        store = new InMemoryRequestStore();
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        registry = newRegistry();
    }

    private RequestRegistry newRegistry() {
        return new RequestRegistry(RequestRegistryTest.config(), gateway, store, clock, new RegistryListener() {
            @Override
            public void onFeesWithdrawn(Wei amount) {
                withdrawals.add(amount);
            }
        });
    }

    private RequestId submit(Address requester) {
        return registry.submit(requester, PROMPT, POLYGON, RECIPIENT, FEE).requestId();
    }

    private RequestId dispatched(Address requester) {
        RequestId id = submit(requester);
        registry.completeGeneration(WORKER, id, URI);
        registry.dispatchCrossChain(WORKER, id);
        return id;
    }

    private RequestId completed(Address requester, long tokenId) {
        RequestId id = dispatched(requester);
        registry.onMintSuccess(GATEWAY, id, tokenId);
        return id;
    }

    // ==================== chains ====================

    @Test
    void registerChainEnablesNewDestination() {
        Address arbMinter = new Address("0x" + "8".repeat(40));

        registry.registerChain(OWNER, 42161L, arbMinter);

        assertEquals(new ChainRegistration(42161L, arbMinter, true), registry.chain(42161L).orElseThrow());
        assertEquals(3, registry.stats().activeChains());
        assertNotNull(registry.submit(USER1, PROMPT, 42161L, RECIPIENT, FEE));
    }

    @Test
    void registerChainReEnablesDisabledChain() {
        registry.unregisterChain(OWNER, SEPOLIA);
        assertFalse(registry.chain(SEPOLIA).orElseThrow().enabled());
        assertEquals(1, registry.stats().activeChains());

        registry.registerChain(OWNER, SEPOLIA, MINTER);

        assertTrue(registry.chain(SEPOLIA).orElseThrow().enabled());
    }

    @Test
    void registerChainValidatesInput() {
        assertEquals("Invalid address", assertThrows(ValidationException.class,
                () -> registry.registerChain(OWNER, 10L, Address.ZERO)).getMessage());
        assertThrows(ValidationException.class, () -> registry.registerChain(OWNER, 0L, MINTER));
        assertThrows(UnauthorizedCallerException.class, () -> registry.registerChain(USER1, 10L, MINTER));
    }

    @Test
    void unregisterUnknownChainIsNotFound() {
        assertThrows(NotFoundException.class, () -> registry.unregisterChain(OWNER, 999L));
    }

    @Test
    void chainsListedInIdOrder() {
        List<ChainRegistration> chains = registry.chains();

        assertEquals(2, chains.size());
        assertEquals(POLYGON, chains.get(0).chainId());
        assertEquals(SEPOLIA, chains.get(1).chainId());
    }

    // ==================== settings ====================

    @Test
    void minimumFeeCanBeRaisedUpToMax() {
        registry.setMinimumFee(OWNER, Wei.fromEther("0.01"));

        assertEquals(Wei.fromEther("0.01"), registry.minimumFee());
        assertThrows(ValidationException.class, () -> submit(USER1));
        assertEquals("Fee too high", assertThrows(ValidationException.class,
                () -> registry.setMinimumFee(OWNER, Wei.fromEther("1.5"))).getMessage());
        registry.setMinimumFee(OWNER, Wei.fromEther("1"));
    }

    @Test
    void feeChangeDoesNotAffectAcceptedRequests() {
        RequestId id = submit(USER1);
        registry.setMinimumFee(OWNER, Wei.fromEther("0.5"));

        assertEquals(FEE, registry.cancel(USER1, id));
    }

    @Test
    void replacedWorkerLosesAccess() {
        RequestId id = submit(USER1);

        registry.setTrustedWorker(OWNER, STRANGER);

        assertEquals(STRANGER, registry.trustedWorker());
        assertThrows(UnauthorizedCallerException.class, () -> registry.markProcessing(WORKER, id));
        registry.markProcessing(STRANGER, id);
        assertThrows(ValidationException.class, () -> registry.setTrustedWorker(OWNER, Address.ZERO));
    }

    @Test
    void adminOperationsRequireOwner() {
        assertThrows(UnauthorizedCallerException.class, () -> registry.setMinimumFee(WORKER, FEE));
        assertThrows(UnauthorizedCallerException.class, () -> registry.setTrustedWorker(USER1, USER1));
        assertThrows(UnauthorizedCallerException.class, () -> registry.pause(WORKER));
        assertThrows(UnauthorizedCallerException.class, () -> registry.unpause(USER1));
        assertThrows(UnauthorizedCallerException.class, () -> registry.unregisterChain(WORKER, POLYGON));
        assertThrows(UnauthorizedCallerException.class, () -> registry.withdrawFees(USER1));
        assertFalse(registry.isPaused());
    }

    @Test
    void pauseBlocksSubmissionsOnly() {
        RequestId id = submit(USER1);
        registry.pause(OWNER);

        assertTrue(registry.isPaused());
        registry.completeGeneration(WORKER, id, URI);
        registry.dispatchCrossChain(WORKER, id);
        assertTrue(registry.onMintSuccess(GATEWAY, id, 1));
    }

    // ==================== fees ====================

    @Test
    void onlyTerminalFeesAreWithdrawable() {
        completed(USER1, 1);
        dispatched(USER1);
        submit(USER2);

        assertEquals(FEE, registry.withdrawableFees());
        assertEquals(FEE, registry.withdrawFees(OWNER));
        assertEquals(Wei.ZERO, registry.withdrawFees(OWNER));
        assertEquals(List.of(FEE, Wei.ZERO), withdrawals);
        assertEquals(FEE, store.withdrawnFees());
    }

    @Test
    void cancelledFeesAreNeverWithdrawable() {
        RequestId id = submit(USER1);
        registry.cancel(USER1, id);

        assertEquals(Wei.ZERO, registry.withdrawableFees());
        assertEquals(FEE, registry.stats().totalFeesRefunded());
    }

    @Test
    void failedRequestStaysEscrowedUntilTerminal() {
        RequestId id = dispatched(USER1);
        registry.onMintFailure(GATEWAY, id, "Royalty too high");
        assertEquals(Wei.ZERO, registry.withdrawableFees());

        registry.retry(USER1, id);
        assertEquals(FEE, registry.cancel(USER1, id));

        assertEquals(Wei.ZERO, registry.withdrawableFees());
    }

    @Test
    void exhaustedRetriesReleaseEscrow() {
        RequestId id = submit(USER1);
        for (int i = 0; i < HubConfig.DEFAULT_MAX_RETRIES; i++) {
            registry.failGeneration(WORKER, id, "model unavailable");
            assertEquals(Wei.ZERO, registry.withdrawableFees());
            registry.retry(USER1, id);
        }
        registry.failGeneration(WORKER, id, "model unavailable");

        assertThrows(RetryLimitExceededException.class, () -> registry.retry(USER1, id));
        assertEquals(FEE, registry.withdrawableFees());
        assertEquals(FEE, newRegistry().withdrawableFees());
        assertEquals(FEE, registry.withdrawFees(OWNER));
    }

    @Test
    void withdrawnTotalSurvivesRestart() {
        completed(USER1, 1);
        registry.withdrawFees(OWNER);

        RequestRegistry restarted = newRegistry();

        assertEquals(Wei.ZERO, restarted.withdrawableFees());
    }

    // ==================== queries ====================

    @Test
    void requestsByRequesterPagesInSubmissionOrder() {
        List<RequestId> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(submit(USER1));
        }
        submit(USER2);

        Page<MintRequest> first = registry.requestsByRequester(USER1, 0, 3);
        Page<MintRequest> second = registry.requestsByRequester(USER1, 3, 3);

        assertEquals(5, first.total());
        assertTrue(first.hasMore());
        assertEquals(ids.subList(0, 3), first.items().stream().map(MintRequest::requestId).toList());
        assertEquals(ids.subList(3, 5), second.items().stream().map(MintRequest::requestId).toList());
        assertFalse(second.hasMore());
        assertTrue(registry.requestsByRequester(USER1, 10, 3).isEmpty());
    }

    @Test
    void requestsByStatusFiltersCurrentState() {
        RequestId pending = submit(USER1);
        RequestId done = completed(USER2, 9);

        assertEquals(List.of(pending), registry.requestsByStatus(RequestStatus.PENDING, 0, 10)
                .items().stream().map(MintRequest::requestId).toList());
        assertEquals(List.of(done), registry.requestsByStatus(RequestStatus.COMPLETED, 0, 10)
                .items().stream().map(MintRequest::requestId).toList());
        assertEquals(0, registry.requestsByStatus(RequestStatus.FAILED, 0, 10).total());
        assertThrows(IllegalArgumentException.class, () -> registry.requestsByStatus(RequestStatus.PENDING, 0, 0));
    }

    @Test
    void stalePendingReportsOldDispatches() {
        RequestId old = dispatched(USER1);
        clock.advance(Duration.ofMinutes(30));
        RequestId fresh = dispatched(USER2);
        clock.advance(Duration.ofMinutes(20));

        List<MintRequest> stale = registry.stalePending(Duration.ofMinutes(40));

        assertEquals(1, stale.size());
        assertEquals(old, stale.get(0).requestId());
        assertEquals(2, registry.stalePending(Duration.ofMinutes(10)).size());

        registry.redispatch(OWNER, old);
        assertTrue(registry.stalePending(Duration.ofMinutes(10)).stream()
                .noneMatch(r -> r.requestId().equals(old)));
        assertTrue(registry.stalePending(Duration.ofMinutes(10)).stream()
                .anyMatch(r -> r.requestId().equals(fresh)));
    }

    @Test
    void staleProcessingReportsAbandonedGeneration() {
        RequestId old = submit(USER1);
        registry.markProcessing(WORKER, old);
        clock.advance(Duration.ofMinutes(30));
        RequestId fresh = submit(USER2);
        registry.markProcessing(WORKER, fresh);
        submit(USER2);

        List<MintRequest> stale = registry.staleProcessing(Duration.ofMinutes(20));

        assertEquals(1, stale.size());
        assertEquals(old, stale.get(0).requestId());
        registry.failGeneration(WORKER, old, "generation timed out");
        assertTrue(registry.staleProcessing(Duration.ofMinutes(20)).isEmpty());
    }

    @Test
    void statsRebuiltFromStore() {
        completed(USER1, 1);
        RequestId failed = dispatched(USER1);
        registry.onMintFailure(GATEWAY, failed, "x");
        registry.cancel(USER2, submit(USER2));
        RequestId beforeRestart = submit(USER1);

        RequestRegistry restarted = newRegistry();

        assertEquals(registry.stats(), restarted.stats());
        RequestId afterRestart = restarted.submit(USER1, PROMPT, POLYGON, RECIPIENT, FEE).requestId();
        assertNotEquals(beforeRestart, afterRestart);
        assertEquals(RequestRegistry.requestId(USER1, PROMPT, 4, RequestRegistryTest.HUB_CHAIN), afterRestart);
    }
}
