// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.codec;

import static io.chainweave.core.codec.AbiWords.WORD;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import io.chainweave.core.error.EnvelopeDecodingException;
import io.chainweave.core.error.EnvelopeEncodingException;
import io.chainweave.core.types.HexData;
import io.chainweave.core.types.RequestId;

/**
 * Encodes and decodes the cross-chain envelopes exchanged between the hub and
 * destination minters.
 *
 * <p>
 * Payloads use the Ethereum ABI tuple layout: a head of 32-byte words holding
 * static values and offsets of dynamic values, followed by the dynamic tails
 * (length word plus zero-padded content). Decoding is strict: the payload must
 * be exactly the canonical encoding of its fields, so truncated data, trailing
 * bytes, misplaced offsets, dirty padding, invalid UTF-8 and an all-zero request
 * id are all rejected with {@link EnvelopeDecodingException} instead of being
 * defaulted.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] payload = EnvelopeCodec.encodeMintInstruction(
 *         new MintInstruction(requestId, recipient, "ipfs://Qm.../metadata.json", 500));
 * MintInstruction decoded = EnvelopeCodec.decodeMintInstruction(payload);
 * }</pre>
 *
 * <p>
 * The codec is stateless and thread-safe.
 */
public final class EnvelopeCodec {

    /** Largest royalty value accepted on the wire (uint16 range). */
    static final int MAX_WIRE_ROYALTY_BITS = 16;

    private EnvelopeCodec() {
    }

    // ==================== Mint instruction ====================

    public static byte[] encodeMintInstruction(final MintInstruction instruction) {
        Objects.requireNonNull(instruction, "instruction");
        requireNonZero(instruction.requestId());
        if (instruction.royaltyBps() >= (1 << MAX_WIRE_ROYALTY_BITS)) {
            throw new EnvelopeEncodingException("royaltyBps does not fit uint16: " + instruction.royaltyBps());
        }
        final byte[] recipient = instruction.recipient().toBytes();
        final byte[] uri = instruction.tokenUri().getBytes(StandardCharsets.UTF_8);

        final int head = 4 * WORD;
        final int recipientOffset = head;
        final int uriOffset = recipientOffset + AbiWords.dynamicSize(recipient.length);
        final ByteBuffer buffer = ByteBuffer.allocate(uriOffset + AbiWords.dynamicSize(uri.length));

        AbiWords.putBytes32(instruction.requestId().toBytes(), buffer);
        AbiWords.putUInt(recipientOffset, buffer);
        AbiWords.putUInt(uriOffset, buffer);
        AbiWords.putUInt(instruction.royaltyBps(), buffer);
        AbiWords.putDynamic(recipient, buffer);
        AbiWords.putDynamic(uri, buffer);
        return buffer.array();
    }

    public static MintInstruction decodeMintInstruction(final byte[] payload) {
        final byte[] data = requirePayload(payload, 4, "mint instruction");
        final RequestId requestId = readRequestId(data);

        final int recipientOffset = AbiWords.readTailOffset(data, WORD, 4 * WORD, "recipient");
        final byte[] recipient = AbiWords.readDynamic(data, recipientOffset, "recipient");
        final int uriOffset = AbiWords.readTailOffset(
                data, 2 * WORD, recipientOffset + AbiWords.dynamicSize(recipient.length), "tokenURI");
        final String tokenUri = AbiWords.readUtf8(data, uriOffset, "tokenURI");
        final int royalty = (int) AbiWords.readUInt(data, 3 * WORD, MAX_WIRE_ROYALTY_BITS, "royaltyBps");

        requireExactEnd(data, uriOffset + AbiWords.dynamicSize(tokenUri.getBytes(StandardCharsets.UTF_8).length));
        return new MintInstruction(requestId, HexData.fromBytes(recipient), tokenUri, royalty);
    }

    // ==================== Failure notice ====================

    public static byte[] encodeFailureNotice(final FailureNotice notice) {
        Objects.requireNonNull(notice, "notice");
        requireNonZero(notice.requestId());
        final byte[] reason = notice.reason().getBytes(StandardCharsets.UTF_8);

        final int reasonOffset = 2 * WORD;
        final ByteBuffer buffer = ByteBuffer.allocate(reasonOffset + AbiWords.dynamicSize(reason.length));
        AbiWords.putBytes32(notice.requestId().toBytes(), buffer);
        AbiWords.putUInt(reasonOffset, buffer);
        AbiWords.putDynamic(reason, buffer);
        return buffer.array();
    }

    public static FailureNotice decodeFailureNotice(final byte[] payload) {
        final byte[] data = requirePayload(payload, 2, "failure notice");
        final RequestId requestId = readRequestId(data);
        final int reasonOffset = AbiWords.readTailOffset(data, WORD, 2 * WORD, "reason");
        final byte[] reason = AbiWords.readDynamic(data, reasonOffset, "reason");
        requireExactEnd(data, reasonOffset + AbiWords.dynamicSize(reason.length));
        return new FailureNotice(requestId, AbiWords.readUtf8(data, reasonOffset, "reason"));
    }

    // ==================== Mint result ====================

    public static byte[] encodeMintResult(final MintResult result) {
        Objects.requireNonNull(result, "result");
        requireNonZero(result.requestId());
        final byte[] reason = result.reason().getBytes(StandardCharsets.UTF_8);

        final int reasonOffset = 4 * WORD;
        final ByteBuffer buffer = ByteBuffer.allocate(reasonOffset + AbiWords.dynamicSize(reason.length));
        AbiWords.putBytes32(result.requestId().toBytes(), buffer);
        AbiWords.putBool(result.success(), buffer);
        AbiWords.putUInt(result.tokenId(), buffer);
        AbiWords.putUInt(reasonOffset, buffer);
        AbiWords.putDynamic(reason, buffer);
        return buffer.array();
    }

    public static MintResult decodeMintResult(final byte[] payload) {
        final byte[] data = requirePayload(payload, 4, "mint result");
        final RequestId requestId = readRequestId(data);
        final boolean success = AbiWords.readBool(data, WORD, "success");
        final long tokenId = AbiWords.readUInt(data, 2 * WORD, 63, "tokenId");
        final int reasonOffset = AbiWords.readTailOffset(data, 3 * WORD, 4 * WORD, "reason");
        final byte[] reason = AbiWords.readDynamic(data, reasonOffset, "reason");
        requireExactEnd(data, reasonOffset + AbiWords.dynamicSize(reason.length));
        if (success && tokenId == 0) {
            throw new EnvelopeDecodingException("successful mint result without token id");
        }
        return new MintResult(requestId, success, tokenId, AbiWords.readUtf8(data, reasonOffset, "reason"));
    }

    // ==================== Helpers ====================

    private static byte[] requirePayload(final byte[] payload, final int headWords, final String kind) {
        if (payload == null) {
            throw new EnvelopeDecodingException(kind + " payload is null");
        }
        if (payload.length % WORD != 0) {
            throw new EnvelopeDecodingException(
                    kind + " payload length " + payload.length + " is not a multiple of " + WORD);
        }
        if (payload.length < headWords * WORD) {
            throw new EnvelopeDecodingException(
                    kind + " payload has " + (payload.length / WORD) + " words, expected at least " + headWords);
        }
        return payload;
    }

    private static RequestId readRequestId(final byte[] data) {
        final RequestId requestId = RequestId.fromBytes(AbiWords.readBytes32(data, 0, "requestId"));
        if (requestId.isZero()) {
            throw new EnvelopeDecodingException("requestId is empty");
        }
        return requestId;
    }

    private static void requireExactEnd(final byte[] data, final int expectedLength) {
        if (data.length != expectedLength) {
            throw new EnvelopeDecodingException(
                    "payload has " + (data.length - expectedLength) + " unexpected trailing bytes");
        }
    }

    private static void requireNonZero(final RequestId requestId) {
        if (requestId.isZero()) {
            throw new EnvelopeEncodingException("requestId is empty");
        }
    }
}
