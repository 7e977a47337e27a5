// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc.exception;

import org.jspecify.annotations.Nullable;

import sh.opbatch.core.error.RpcException;

/**
 * Thrown when all retry attempts have been exhausted.
 * <p>
 * The cause is the final (most recent) failure. Earlier failures are attached in
 * attempt order and can be read through {@link #getSuppressed()}.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try {
 *     RpcRetry.run(() -> client.sendBundle(ops, entryPoint), config, Sleeper.SYSTEM);
 * } catch (RetryExhaustedException e) {
 *     log.error("Gave up after {} attempts ({} ms)", e.getAttemptCount(), e.getTotalRetryDurationMs());
 * }
 * }</pre>
 */
public final class RetryExhaustedException extends RuntimeException {

    /** Explicit UID for serialization stability across class evolution. */
    private static final long serialVersionUID = 1L;

    private final int attemptCount;
    private final long totalRetryDurationMs;

    /**
     * Creates a new RetryExhaustedException.
     *
     * @param attemptCount the total number of attempts made
     * @param totalRetryDurationMs the total time spent retrying in milliseconds
     * @param cause the final failure that triggered this exception
     */
    public RetryExhaustedException(
            final int attemptCount,
            final long totalRetryDurationMs,
            final Throwable cause) {
        super(
            String.format("All %d retry attempts exhausted (total: %dms)", attemptCount, totalRetryDurationMs),
            cause
        );
        this.attemptCount = attemptCount;
        this.totalRetryDurationMs = totalRetryDurationMs;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public long getTotalRetryDurationMs() {
        return totalRetryDurationMs;
    }

    /**
     * Returns the RPC error code from the final failure, if available.
     *
     * @return the error code, or 0 if not an RPC error
     */
    public int getRpcErrorCode() {
        if (getCause() instanceof RpcException rpc) {
            return rpc.code();
        }
        return 0;
    }

    /**
     * Returns the RPC error data from the final failure, if available.
     *
     * @return the error data string, or {@code null} if not an RPC error or no data
     */
    public @Nullable String getRpcErrorData() {
        if (getCause() instanceof RpcException rpc) {
            return rpc.data();
        }
        return null;
    }
}
