// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core;

/**
 * Global toggle for RPC wire tracing.
 */
public final class OpBatchDebug {

    private static volatile boolean rpcLogging = false;

    private OpBatchDebug() {
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }
}
