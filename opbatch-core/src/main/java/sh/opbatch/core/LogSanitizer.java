// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts operation signatures so traces cannot be replayed from logs</li>
 * <li>Truncates excessively long logs, such as large bundles</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"signature\"")) {
            sanitized =
                    sanitized.replaceAll(
                            "\\\"signature\\\"\\s*:\\s*\\\"0x[^\\\"]+\\\"",
                            "\"signature\":\"0x***[REDACTED]***\"");
        }

        if (sanitized.contains("signature=0x")) {
            sanitized = sanitized.replaceAll("signature=0x[0-9a-fA-F]+", "signature=0x***[REDACTED]***");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
