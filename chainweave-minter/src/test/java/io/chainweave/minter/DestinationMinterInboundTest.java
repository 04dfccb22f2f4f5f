// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import io.chainweave.core.codec.EnvelopeCodec;
import io.chainweave.core.codec.FailureNotice;
import io.chainweave.core.codec.MintInstruction;
import io.chainweave.core.codec.MintResult;
import io.chainweave.core.error.EnvelopeDecodingException;
import io.chainweave.core.error.UnauthorizedCallerException;
import io.chainweave.core.types.Address;
import io.chainweave.core.types.HexData;
import io.chainweave.core.types.RequestId;
import io.chainweave.gateway.CallContext;
import io.chainweave.gateway.MessagingGateway;

/**
 * Mint instructions arriving through the gateway and the results sent back.
 */
@ExtendWith(MockitoExtension.class)
class DestinationMinterInboundTest {

    private static final long HUB_CHAIN = 1L;
    private static final Address OWNER = new Address("0x" + "1".repeat(40));
    private static final Address GATEWAY = new Address("0x" + "2".repeat(40));
    private static final Address HUB = new Address("0x" + "3".repeat(40));
    private static final Address USER = new Address("0x" + "4".repeat(40));
    private static final Address PRINCIPAL = new Address("0x" + "a".repeat(40));
    private static final RequestId REQUEST = new RequestId("0x" + "ab".repeat(32));
    private static final CallContext FROM_HUB = new CallContext(PRINCIPAL, HUB_CHAIN, HUB);

    @Mock
    private MessagingGateway gateway;

    private DestinationMinter minter;
    private final Logger logger = (Logger) LoggerFactory.getLogger(DestinationMinter.class);
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        MinterConfig config = MinterConfig.builder()
                .chainId(137)
                .owner(OWNER)
                .gatewayIdentity(GATEWAY)
                .trustedHub(HUB)
                .build();
        minter = new DestinationMinter(config, gateway, new InMemoryProcessedRequestStore(),
                Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private static byte[] instruction(HexData recipient, String uri, int royalty) {
        return EnvelopeCodec.encodeMintInstruction(new MintInstruction(REQUEST, recipient, uri, royalty));
    }

    private List<MintResult> sentResults(int expected) {
        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(gateway, times(expected)).send(eq(HUB_CHAIN), eq(HUB), captor.capture());
        return captor.getAllValues().stream().map(EnvelopeCodec::decodeMintResult).toList();
    }

    @Test
    void mintsAndRepliesWithSuccess() {
        minter.onCall(GATEWAY, FROM_HUB, instruction(HexData.of(USER.value()), "ipfs://art", 500));

        MintResult result = sentResults(1).get(0);
        assertTrue(result.success());
        assertEquals(REQUEST, result.requestId());
        assertEquals(1, result.tokenId());
        assertEquals(USER, minter.token(1).orElseThrow().owner());
    }

    @Test
    void redeliveryRepliesWithDuplicateFailure() {
        byte[] payload = instruction(HexData.of(USER.value()), "ipfs://art", 500);

        minter.onCall(GATEWAY, FROM_HUB, payload);
        minter.onCall(GATEWAY, FROM_HUB, payload);

        List<MintResult> results = sentResults(2);
        assertTrue(results.get(0).success());
        MintResult duplicate = results.get(1);
        assertFalse(duplicate.success());
        assertEquals(1, duplicate.tokenId());
        assertTrue(duplicate.reason().startsWith("duplicate request"));
        assertEquals(1, minter.collectionStats().totalMinted());
        assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("Duplicate mint")));
    }

    @Test
    void businessFailureIsReportedNotDropped() {
        minter.onCall(GATEWAY, FROM_HUB, instruction(HexData.of(Address.ZERO.value()), "ipfs://art", 500));

        MintResult result = sentResults(1).get(0);
        assertFalse(result.success());
        assertEquals("Invalid recipient", result.reason());
        assertFalse(minter.isRequestProcessed(REQUEST));
    }

    @Test
    void excessiveRoyaltyIsReported() {
        minter.onCall(GATEWAY, FROM_HUB, instruction(HexData.of(USER.value()), "ipfs://art", 5000));

        assertEquals("Royalty too high", sentResults(1).get(0).reason());
    }

    @Test
    void pausedMinterReportsFailure() {
        minter.pause(OWNER);

        minter.onCall(GATEWAY, FROM_HUB, instruction(HexData.of(USER.value()), "ipfs://art", 500));

        assertFalse(sentResults(1).get(0).success());
    }

    @Test
    void redeliveryToPausedMinterStillCarriesExistingToken() {
        byte[] payload = instruction(HexData.of(USER.value()), "ipfs://art", 500);
        minter.onCall(GATEWAY, FROM_HUB, payload);
        minter.pause(OWNER);

        minter.onCall(GATEWAY, FROM_HUB, payload);

        MintResult duplicate = sentResults(2).get(1);
        assertFalse(duplicate.success());
        assertEquals(1, duplicate.tokenId());
        assertTrue(duplicate.reason().startsWith("duplicate request"));
    }

    @Test
    void undecodablePayloadThrowsWithoutReply() {
        assertThrows(EnvelopeDecodingException.class, () -> minter.onCall(GATEWAY, FROM_HUB, new byte[] {1, 2, 3}));
        verifyNoInteractions(gateway);
    }

    @Test
    void rejectsInstructionFromUntrustedHub() {
        CallContext elsewhere = new CallContext(PRINCIPAL, HUB_CHAIN, USER);

        assertThrows(UnauthorizedCallerException.class,
                () -> minter.onCall(GATEWAY, elsewhere, instruction(HexData.of(USER.value()), "ipfs://art", 500)));
        verifyNoInteractions(gateway);
        assertFalse(minter.isRequestProcessed(REQUEST));
    }

    @Test
    void rejectsCallNotForwardedByOwnGateway() {
        assertThrows(UnauthorizedCallerException.class,
                () -> minter.onCall(HUB, FROM_HUB, instruction(HexData.of(USER.value()), "ipfs://art", 500)));
        verify(gateway, times(0)).send(anyLong(), any(), any());
    }

    @Test
    void revertOfResultIsLogged() {
        byte[] notice = EnvelopeCodec.encodeFailureNotice(new FailureNotice(REQUEST, "hub unreachable"));

        minter.onRevert(GATEWAY, FROM_HUB, notice);

        assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("hub unreachable")));
        verifyNoInteractions(gateway);
    }
}
