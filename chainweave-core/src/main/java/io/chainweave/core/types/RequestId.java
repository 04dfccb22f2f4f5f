// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import io.chainweave.primitives.Hex;

/**
 * Hex-encoded 32-byte mint request identifier.
 * <p>
 * The id is the idempotency key of the whole protocol: the hub keys its request
 * store by it and every destination minter records it in its processed set.
 * The all-zero id is representable (so that malformed envelopes can be
 * inspected) but {@link #isZero()} ids are rejected wherever an id is accepted.
 *
 * @since 0.1.0
 */
public record RequestId(@com.fasterxml.jackson.annotation.JsonValue String value) {
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);
    private static final String ZERO_VALUE = "0x" + "0".repeat(BYTE_LENGTH * 2);

    public RequestId {
        Objects.requireNonNull(value, "requestId");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid request id: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    @com.fasterxml.jackson.annotation.JsonCreator(mode = com.fasterxml.jackson.annotation.JsonCreator.Mode.DELEGATING)
    public static RequestId of(final String value) {
        return new RequestId(value);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isZero() {
        return ZERO_VALUE.equals(value);
    }

    public static RequestId fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Request id must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new RequestId("0x" + Hex.encodeNoPrefix(bytes));
    }

    /**
     * Short form for log lines: first four bytes.
     */
    public String shortForm() {
        return value.substring(0, 10);
    }

    @Override
    public String toString() {
        return value;
    }
}
