// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for RPC traffic.
 *
 * <p>
 * Messages go to the {@code sh.opbatch.debug} SLF4J logger at INFO level, only
 * while {@link OpBatchDebug} is enabled, and always pass through {@link LogSanitizer}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.opbatch.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!OpBatchDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
