// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.types;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Represents arbitrary-length hexadecimal-encoded byte data with "0x" prefix.
 *
 * <p>
 * In a user operation this carries the init code, call data, paymaster data and
 * signature. The value must:
 * <ul>
 * <li>Start with "0x" prefix</li>
 * <li>Contain only hex characters (0-9, a-f, A-F)</li>
 * <li>Have an even number of hex digits (each byte = 2 hex chars)</li>
 * </ul>
 *
 * <p>
 * The original casing is kept so a value read from the queue is written back unchanged.
 */
public final class HexData {
    private static final Pattern HEX = HexValidator.evenLength();
    public static final HexData EMPTY = new HexData("0x");

    private final String value;

    /**
     * Creates a HexData from a hex string.
     *
     * @param value the hex-encoded string with "0x" prefix
     * @throws IllegalArgumentException if the value is not even-length prefixed hex
     */
    public HexData(String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.value = value;
    }

    /**
     * Returns the hex string representation with "0x" prefix.
     *
     * @return the hex string
     */
    @com.fasterxml.jackson.annotation.JsonValue
    public String value() {
        return value;
    }

    public int byteLength() {
        return (value.length() - 2) / 2;
    }

    public boolean isEmpty() {
        return value.length() == 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        HexData hexData = (HexData) o;
        return value.equalsIgnoreCase(hexData.value);
    }

    @Override
    public int hashCode() {
        return value.toLowerCase(java.util.Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return "HexData[" + "value=" + value + ']';
    }
}
