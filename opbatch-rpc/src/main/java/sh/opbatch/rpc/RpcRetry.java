// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.opbatch.core.error.RpcException;
import sh.opbatch.rpc.exception.RetryExhaustedException;

/**
 * Retries a relay call with exponential backoff.
 *
 * <p>
 * The loop is an explicit state machine over the attempt count:
 * <ul>
 * <li><strong>Attempting(n):</strong> invoke the supplier once.</li>
 * <li><strong>Success:</strong> the supplier returned; its value is returned.</li>
 * <li><strong>Failed, n &lt; max:</strong> sleep {@link RpcRetryConfig#backoffMillis(int)} and attempt again.</li>
 * <li><strong>Exhausted:</strong> the max-th attempt failed; a {@link RetryExhaustedException}
 * is thrown without a further sleep.</li>
 * </ul>
 *
 * <p>
 * <strong>Retryable failures:</strong> every {@link RpcException} (network errors, non-2xx
 * statuses and relay error objects alike) and any runtime exception caused by an
 * {@link IOException}. Anything else is a programming error and propagates immediately.
 *
 * <p>
 * <strong>Thread Interruption:</strong> If the calling thread is interrupted during
 * backoff, the loop stops and rethrows the last failure with the
 * {@link InterruptedException} attached as suppressed.
 */
public final class RpcRetry {

    private static final Logger log = LoggerFactory.getLogger(RpcRetry.class);

    private RpcRetry() {
    }

    /**
     * Executes the supplier with retry on transient failures.
     *
     * @param <T>      the return type
     * @param supplier the operation to retry
     * @param config   attempt ceiling and backoff timing
     * @param sleeper  blocks between attempts
     * @return the result from the first successful attempt
     * @throws RetryExhaustedException if every attempt failed
     * @throws RuntimeException        the last failure, if interrupted while waiting to retry
     */
    public static <T> T run(final Supplier<T> supplier, final RpcRetryConfig config, final Sleeper sleeper) {
        Objects.requireNonNull(supplier, "supplier");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(sleeper, "sleeper");

        final List<RuntimeException> failedAttempts = new ArrayList<>();
        final long startTime = System.currentTimeMillis();

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                return supplier.get();
            } catch (RpcException e) {
                failedAttempts.add(e);
            } catch (RuntimeException e) {
                if (unwrapIo(e) == null) {
                    throw e;
                }
                failedAttempts.add(e);
            }

            final RuntimeException last = failedAttempts.get(failedAttempts.size() - 1);
            if (attempt == config.maxAttempts()) {
                log.warn("Attempt {}/{} failed: {}", attempt, config.maxAttempts(), last.getMessage());
                break;
            }

            final long delayMillis = config.backoffMillis(attempt);
            log.warn("Attempt {}/{} failed: {}. Waiting {}ms",
                    attempt, config.maxAttempts(), last.getMessage(), delayMillis);
            try {
                sleeper.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                last.addSuppressed(e);
                throw last;
            }
        }

        throw createRetryExhaustedException(failedAttempts, startTime);
    }

    private static RetryExhaustedException createRetryExhaustedException(
            final List<RuntimeException> failedAttempts,
            final long startTime) {
        final long totalDuration = System.currentTimeMillis() - startTime;
        final RuntimeException lastFailure = failedAttempts.get(failedAttempts.size() - 1);

        final RetryExhaustedException exhausted = new RetryExhaustedException(
                failedAttempts.size(),
                totalDuration,
                lastFailure
        );

        for (int i = 0; i < failedAttempts.size() - 1; i++) {
            exhausted.addSuppressed(failedAttempts.get(i));
        }

        return exhausted;
    }

    private static IOException unwrapIo(final RuntimeException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof IOException io) {
                return io;
            }
            current = current.getCause();
        }
        return null;
    }
}
