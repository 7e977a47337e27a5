// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.primitives;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Utility methods for hex encoding/decoding with optional {@code 0x} prefixes.
 *
 * <p>Two encodings are supported:
 * <ul>
 * <li><b>Byte strings</b> ({@link #encode(byte[])}, {@link #decode(String)}): even length,
 * one pair of characters per byte, {@code "0x"} is the empty byte string.</li>
 * <li><b>Quantities</b> ({@link #encodeQuantity(BigInteger)}, {@link #decodeQuantity(String)}):
 * non-negative integers without leading zeros, as used by JSON-RPC for numeric fields.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Convert a {@code 0x}-prefixed hex string into a byte array.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final int len = hexLength / 2;
        final byte[] result = new byte[len];

        for (int i = 0; i < len; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }

        return result;
    }

    /**
     * Convert a byte array into a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Convert a byte array into a lowercase hex string without a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Encodes a non-negative integer as a JSON-RPC quantity ({@code 0x0}, {@code 0x1a}, ...).
     *
     * @param value the value to encode
     * @return the quantity string, lowercase and without leading zeros
     * @throws IllegalArgumentException if {@code value} is null or negative
     */
    public static String encodeQuantity(final BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("quantity must be non-negative: " + value);
        }
        return "0x" + value.toString(16);
    }

    /**
     * Decodes a quantity string into a non-negative integer.
     *
     * <p>{@code 0x}-prefixed input is read as base 16 and must carry at least one digit.
     * Input without the prefix is read as base 10, matching how queue producers that
     * write plain decimal numbers are handled. Leading zeros are tolerated in both forms.
     *
     * @param quantity the string to decode
     * @return the decoded value
     * @throws IllegalArgumentException if the input is null, empty, signed or not a number
     */
    public static BigInteger decodeQuantity(final String quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        final String trimmed = quantity.trim();
        final boolean hex = hasPrefix(trimmed);
        final String digits = hex ? trimmed.substring(2) : trimmed;
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("quantity has no digits: " + quantity);
        }
        for (int i = 0; i < digits.length(); i++) {
            final char c = digits.charAt(i);
            final boolean valid = hex
                    ? c < NIBBLE_LOOKUP.length && NIBBLE_LOOKUP[c] != -1
                    : c >= '0' && c <= '9';
            if (!valid) {
                throw new IllegalArgumentException("invalid quantity: " + quantity);
            }
        }
        return new BigInteger(digits, hex ? 16 : 10);
    }

    /**
     * Returns {@code true} if the provided string starts with {@code 0x}
     * (case-insensitive).
     *
     * @param hexString the string to check
     * @return {@code true} when the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
