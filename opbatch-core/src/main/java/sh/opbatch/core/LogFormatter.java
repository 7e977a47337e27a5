// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core;

import java.util.Locale;

/**
 * Plain-text formatter for RPC trace lines.
 *
 * <p>
 * All lines use a bracketed {@code [OPERATION]} tag followed by {@code key=value}
 * pairs; long hex values are shortened to {@code 0x1234...5678}.
 *
 * <pre>{@code
 * DebugLogger.logRpc(LogFormatter.formatRpc("eth_gasPrice", 1060));
 * // [RPC] method=eth_gasPrice duration=1.06ms
 *
 * DebugLogger.logRpc(LogFormatter.formatRpcError("eth_sendUserOperationBundle", -32001, "HTTP 502", 900));
 * // [RPC-ERROR] method=eth_sendUserOperationBundle code=-32001 message=HTTP 502 duration=900us
 * }</pre>
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=eth_gasPrice duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format("[RPC] method=%s %s", method, duration(durationMicros));
    }

    /**
     * Format: [RPC-ERROR] method=eth_gasPrice code=-32000 message=boom duration=1.06ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "[RPC-ERROR] method=%s code=%s message=%s %s",
                method,
                code,
                message,
                duration(durationMicros));
    }

    /**
     * Format: [BUNDLE-SEND] ops=3 entryPoint=0x0576...1b57
     */
    public static String formatBundleSend(int operationCount, String entryPoint) {
        return String.format(
                "[BUNDLE-SEND] ops=%d entryPoint=%s",
                operationCount,
                shortenHash(entryPoint));
    }

    /**
     * Shortens long hex values to {@code 0x1234...5678}; short values are returned unchanged.
     */
    public static String shortenHash(String hash) {
        if (hash == null || hash.length() <= HASH_SHORTEN_THRESHOLD) {
            return hash;
        }
        return hash.substring(0, HASH_PREFIX_LENGTH) + "..." + hash.substring(hash.length() - HASH_SUFFIX_LENGTH);
    }

    private static String duration(long micros) {
        if (micros < 1_000) {
            return "duration=" + micros + "us";
        }
        if (micros < 1_000_000) {
            return String.format(Locale.ROOT, "duration=%.2fms", micros / 1_000.0);
        }
        return String.format(Locale.ROOT, "duration=%.1fs", micros / 1_000_000.0);
    }
}
