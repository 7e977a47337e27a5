// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.submit;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.opbatch.batcher.queue.QueueStore;
import sh.opbatch.batcher.ratelimit.RateLimiter;
import sh.opbatch.batcher.select.Selection;
import sh.opbatch.core.error.QueueStoreException;
import sh.opbatch.core.model.QueueEntry;
import sh.opbatch.core.model.UserOperation;
import sh.opbatch.core.types.Address;
import sh.opbatch.rpc.BundleReceipt;
import sh.opbatch.rpc.BundlerClient;
import sh.opbatch.rpc.RpcRetry;
import sh.opbatch.rpc.RpcRetryConfig;
import sh.opbatch.rpc.Sleeper;
import sh.opbatch.rpc.exception.RetryExhaustedException;

/**
 * Sends one bundle with retry, then commits the queue.
 *
 * <p>
 * The queue and the rate windows are written only after the relay accepted the
 * bundle. When every attempt fails nothing is written. Once the relay has accepted,
 * the sent entries must leave the queue even if the store cannot be re-read, so
 * arrivals are then given up in favour of the run's own retained entries.
 */
public final class SubmissionPipeline {

    private static final Logger log = LoggerFactory.getLogger(SubmissionPipeline.class);

    private final BundlerClient client;
    private final QueueStore queueStore;
    private final RateLimiter rateLimiter;
    private final RpcRetryConfig retryConfig;
    private final Sleeper sleeper;

    public SubmissionPipeline(
            final BundlerClient client,
            final QueueStore queueStore,
            final RateLimiter rateLimiter,
            final RpcRetryConfig retryConfig,
            final Sleeper sleeper) {
        this.client = Objects.requireNonNull(client, "client");
        this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Submits {@code operations} and persists the remaining queue.
     *
     * @param selection  the partition the operations came from
     * @param operations the operations to bundle, fees already filled
     * @param entryPoint the EntryPoint contract
     * @return the relay's receipt
     * @throws RetryExhaustedException if every attempt failed; the queue is untouched
     */
    public BundleReceipt submit(
            final Selection selection,
            final List<UserOperation> operations,
            final Address entryPoint) {
        Objects.requireNonNull(selection, "selection");
        Objects.requireNonNull(operations, "operations");
        Objects.requireNonNull(entryPoint, "entryPoint");

        final BundleReceipt receipt = RpcRetry.run(
                () -> client.sendBundle(operations, entryPoint), retryConfig, sleeper);
        log.info("Bundle sent: {}", receipt);

        final List<QueueEntry> remaining = remainingAfterSend(selection);
        queueStore.save(remaining);
        rateLimiter.recordSent(selection.sentPerTarget());
        log.info("Queue updated: {} sent, {} remaining", operations.size(), remaining.size());
        return receipt;
    }

    private List<QueueEntry> remainingAfterSend(final Selection selection) {
        try {
            return selection.remainingWith(queueStore.load());
        } catch (QueueStoreException e) {
            log.error("Queue unreadable after send; entries enqueued during this run are lost", e);
            return selection.retained();
        }
    }
}
