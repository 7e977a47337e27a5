// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.types;

import java.math.BigInteger;
import java.util.Objects;

import sh.opbatch.primitives.Hex;

/**
 * Represents a quantity in Wei (10^-18 Ether).
 * <p>
 * Fee fields and policy ceilings are both held as {@code Wei} so they are always
 * compared numerically in the same unit, never as hex text.
 * <p>
 * <strong>Common Conversions:</strong>
 * <ul>
 * <li>1 Ether = 10^18 Wei</li>
 * <li>1 Gwei = 10^9 Wei</li>
 * </ul>
 */
public record Wei(BigInteger value) implements Comparable<Wei> {
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

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(GWEI_MULTIPLIER));
    }

    /**
     * Parses a JSON-RPC quantity ({@code 0x}-prefixed hex, or decimal).
     *
     * @param quantity the quantity string
     * @return the parsed amount
     * @throws IllegalArgumentException if the string is not a non-negative number
     */
    public static Wei fromQuantity(final String quantity) {
        return new Wei(Hex.decodeQuantity(quantity));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isGreaterThan(final Wei other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(final Wei other) {
        return value.compareTo(other.value);
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String toHexString() {
        return Hex.encodeQuantity(value);
    }
}
