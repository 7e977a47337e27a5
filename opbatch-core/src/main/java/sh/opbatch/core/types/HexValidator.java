// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for validating hex strings.
 * <p>
 * Used by {@link Address} and {@link HexData} so both apply the same rules.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private static final Pattern EVEN_LENGTH = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    private HexValidator() {}

    /**
     * Creates a compiled pattern that matches hex strings of exactly the specified byte length.
     * <p>
     * The pattern requires:
     * <ul>
     *   <li>"0x" prefix</li>
     *   <li>Exactly {@code byteLength * 2} hex characters (0-9, a-f, A-F)</li>
     * </ul>
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a compiled pattern matching hex strings of the specified length
     */
    public static Pattern fixedLength(int byteLength) {
        int hexChars = byteLength * 2;
        return Pattern.compile("^0x[0-9a-fA-F]{" + hexChars + "}$");
    }

    /**
     * Returns the pattern for {@code 0x}-prefixed byte strings of any length, including {@code "0x"}.
     *
     * @return the shared pattern
     */
    public static Pattern evenLength() {
        return EVEN_LENGTH;
    }
}
