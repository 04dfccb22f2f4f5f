// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import io.chainweave.primitives.Hex;

/**
 * Hex-encoded 20-byte account identifier.
 * <p>
 * Used for requesters, token owners, minter endpoints and the trusted identities
 * (owner, AI worker, gateway, transport principal) that guarded operations check
 * against.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /** The zero address, never a valid recipient or identity. */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    @com.fasterxml.jackson.annotation.JsonCreator(mode = com.fasterxml.jackson.annotation.JsonCreator.Mode.DELEGATING)
    public static Address of(final String value) {
        return new Address(value);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
