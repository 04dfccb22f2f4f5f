// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.codec;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import io.chainweave.core.error.EnvelopeDecodingException;

/**
 * 32-byte word primitives for the ABI head/tail layout used by envelopes.
 * <p>
 * Writers assume a buffer sized by {@link #dynamicSize(int)}; readers bounds-check
 * every access and report violations as {@link EnvelopeDecodingException}.
 */
final class AbiWords {

    static final int WORD = 32;

    private AbiWords() {
    }

    /** Size of a dynamic {@code bytes}/{@code string} tail: length word plus padded content. */
    static int dynamicSize(final int contentLength) {
        return WORD + padded(contentLength);
    }

    static int padded(final int length) {
        return (length + WORD - 1) / WORD * WORD;
    }

    static void putUInt(final long value, final ByteBuffer buffer) {
        buffer.putLong(0L);
        buffer.putLong(0L);
        buffer.putLong(0L);
        buffer.putLong(value);
    }

    static void putBool(final boolean value, final ByteBuffer buffer) {
        putUInt(value ? 1L : 0L, buffer);
    }

    static void putBytes32(final byte[] value, final ByteBuffer buffer) {
        buffer.put(value);
    }

    static void putDynamic(final byte[] content, final ByteBuffer buffer) {
        putUInt(content.length, buffer);
        buffer.put(content);
        final int padding = padded(content.length) - content.length;
        for (int i = 0; i < padding; i++) {
            buffer.put((byte) 0);
        }
    }

    static byte[] readBytes32(final byte[] data, final int offset, final String field) {
        requireAvailable(data, offset, WORD, field);
        final byte[] out = new byte[WORD];
        System.arraycopy(data, offset, out, 0, WORD);
        return out;
    }

    /**
     * Reads an unsigned word that must fit in {@code maxBits} bits.
     */
    static long readUInt(final byte[] data, final int offset, final int maxBits, final String field) {
        requireAvailable(data, offset, WORD, field);
        final byte[] word = new byte[WORD];
        System.arraycopy(data, offset, word, 0, WORD);
        final BigInteger value = new BigInteger(1, word);
        if (value.bitLength() > maxBits) {
            throw new EnvelopeDecodingException(field + " out of range: " + value);
        }
        return value.longValueExact();
    }

    static boolean readBool(final byte[] data, final int offset, final String field) {
        final long value = readUInt(data, offset, 8, field);
        if (value > 1) {
            throw new EnvelopeDecodingException(field + " is not a boolean: " + value);
        }
        return value == 1;
    }

    /**
     * Reads the offset word of a dynamic field and checks it points at {@code expectedOffset},
     * the position the canonical encoding would place the tail at.
     */
    static int readTailOffset(final byte[] data, final int headOffset, final int expectedOffset, final String field) {
        final long offset = readUInt(data, headOffset, 31, field + " offset");
        if (offset != expectedOffset) {
            throw new EnvelopeDecodingException(
                    field + " offset " + offset + " does not match canonical position " + expectedOffset);
        }
        return (int) offset;
    }

    /**
     * Reads a dynamic tail at {@code offset}, verifying length, bounds and zero padding.
     */
    static byte[] readDynamic(final byte[] data, final int offset, final String field) {
        final long length = readUInt(data, offset, 31, field + " length");
        final int start = offset + WORD;
        requireAvailable(data, start, padded((int) length), field);
        final byte[] out = new byte[(int) length];
        System.arraycopy(data, start, out, 0, out.length);
        for (int i = start + out.length; i < start + padded(out.length); i++) {
            if (data[i] != 0) {
                throw new EnvelopeDecodingException(field + " has non-zero padding");
            }
        }
        return out;
    }

    static String readUtf8(final byte[] data, final int offset, final String field) {
        final byte[] raw = readDynamic(data, offset, field);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EnvelopeDecodingException(field + " is not valid UTF-8", e);
        }
    }

    static void requireAvailable(final byte[] data, final int offset, final int length, final String field) {
        if (offset < 0 || length < 0 || (long) offset + length > data.length) {
            throw new EnvelopeDecodingException(
                    "Data too short for " + field + ": need " + ((long) offset + length) + " bytes, have " + data.length);
        }
    }
}
