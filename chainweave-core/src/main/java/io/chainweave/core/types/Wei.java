// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Non-negative amount of the hub chain's native currency, in Wei (10^-18 Ether).
 * <p>
 * Request fees, refunds and withdrawals are all expressed in Wei.
 */
public record Wei(BigInteger value) implements Comparable<Wei> {
    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(18);
    private static final BigInteger GWEI_MULTIPLIER = BigInteger.valueOf(1_000_000_000L);

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    @com.fasterxml.jackson.annotation.JsonCreator(mode = com.fasterxml.jackson.annotation.JsonCreator.Mode.DELEGATING)
    public static Wei parse(final String decimal) {
        Objects.requireNonNull(decimal, "decimal");
        return new Wei(new BigInteger(decimal.trim()));
    }

    public static Wei fromEther(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return new Wei(ether.multiply(WEI_PER_ETHER).toBigIntegerExact());
    }

    public static Wei fromEther(final String ether) {
        return fromEther(new BigDecimal(ether));
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(GWEI_MULTIPLIER));
    }

    public Wei plus(final Wei other) {
        return new Wei(value.add(other.value));
    }

    /**
     * @throws IllegalArgumentException if the result would be negative
     */
    public Wei minus(final Wei other) {
        return new Wei(value.subtract(other.value));
    }

    public boolean isLessThan(final Wei other) {
        return value.compareTo(other.value) < 0;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public BigDecimal toEther() {
        return new BigDecimal(value).divide(WEI_PER_ETHER, 18, RoundingMode.DOWN);
    }

    @Override
    public int compareTo(final Wei other) {
        return value.compareTo(other.value);
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String toDecimalString() {
        return value.toString();
    }

    @Override
    public String toString() {
        return value + " wei";
    }
}
