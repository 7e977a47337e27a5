// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

/**
 * Configuration for retrying relay calls with exponential backoff.
 *
 * <p>This record holds the attempt ceiling and the backoff timing:
 * <ul>
 *   <li>{@code maxAttempts} - total attempts including the first (default: 5)</li>
 *   <li>{@code backoffBaseMs} - unit delay in milliseconds (default: 1000ms)</li>
 *   <li>{@code backoffMaxMs} - maximum delay cap in milliseconds (default: 60000ms)</li>
 * </ul>
 *
 * <p><strong>Backoff Formula</strong> (after the n-th failed attempt, n &lt; maxAttempts):
 * <pre>
 *   delay = min(base * 2^n, max)
 * </pre>
 * With the defaults the waits are 2s, 4s, 8s, 16s and no wait follows the fifth failure.
 *
 * <pre>{@code
 * RpcRetryConfig config = RpcRetryConfig.builder()
 *     .maxAttempts(3)
 *     .backoffMaxMs(10_000)
 *     .build();
 * }</pre>
 *
 * @param maxAttempts   total attempts (must be &gt;= 1)
 * @param backoffBaseMs unit delay in milliseconds (must be &gt; 0)
 * @param backoffMaxMs  maximum delay cap in milliseconds (must be &gt;= backoffBaseMs)
 * @see RpcRetry
 */
public record RpcRetryConfig(
        int maxAttempts,
        long backoffBaseMs,
        long backoffMaxMs) {

    /** Default attempt ceiling: 5. */
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    /** Default unit delay: 1s. */
    public static final long DEFAULT_BACKOFF_BASE_MS = 1_000;

    /** Default maximum delay: 60s. */
    public static final long DEFAULT_BACKOFF_MAX_MS = 60_000;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public RpcRetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException("backoffBaseMs must be > 0, got: " + backoffBaseMs);
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                    "backoffMaxMs must be >= backoffBaseMs, got: " + backoffMaxMs + " < " + backoffBaseMs);
        }
    }

    /**
     * Returns the default configuration.
     *
     * @return default config with 5 attempts, 1s base, 60s max
     */
    public static RpcRetryConfig defaults() {
        return new RpcRetryConfig(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_BASE_MS, DEFAULT_BACKOFF_MAX_MS);
    }

    /**
     * Returns the delay to wait after the given number of failed attempts.
     *
     * @param failedAttempts attempts failed so far (&gt;= 1)
     * @return the delay in milliseconds, never above {@link #backoffMaxMs()}
     */
    public long backoffMillis(final int failedAttempts) {
        if (failedAttempts < 1) {
            throw new IllegalArgumentException("failedAttempts must be >= 1, got: " + failedAttempts);
        }
        if (failedAttempts >= Long.numberOfLeadingZeros(backoffBaseMs) - 1) {
            return backoffMaxMs;
        }
        return Math.min(backoffBaseMs << failedAttempts, backoffMaxMs);
    }

    /**
     * Creates a new builder for custom configuration.
     *
     * @return a new builder initialized with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating custom {@link RpcRetryConfig} instances.
     *
     * <p>All values are initialized to defaults and can be selectively overridden.
     */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
            return this;
        }

        public Builder backoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return new immutable {@link RpcRetryConfig}
         * @throws IllegalArgumentException if any parameter is invalid
         */
        public RpcRetryConfig build() {
            return new RpcRetryConfig(maxAttempts, backoffBaseMs, backoffMaxMs);
        }
    }
}
