// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import io.chainweave.primitives.Hex;

/**
 * Arbitrary-length byte string with a {@code 0x}-prefixed hex representation.
 * <p>
 * Carries chain-specific opaque values such as the mint recipient, whose
 * encoding depends on the destination chain.
 *
 * @since 0.1.0
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;

    private HexData(final byte[] raw) {
        this.raw = raw;
    }

    /**
     * Parses a {@code 0x}-prefixed, even-length hex string.
     *
     * @throws IllegalArgumentException if the value is not valid hex data
     */
    @com.fasterxml.jackson.annotation.JsonCreator(mode = com.fasterxml.jackson.annotation.JsonCreator.Mode.DELEGATING)
    public static HexData of(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        return new HexData(Hex.decode(value));
    }

    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String value() {
        return Hex.encode(raw);
    }

    public int byteLength() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    public byte[] toBytes() {
        return raw.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(raw, ((HexData) o).raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[value=" + value() + ']';
    }
}
