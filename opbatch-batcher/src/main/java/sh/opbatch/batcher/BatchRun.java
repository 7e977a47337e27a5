// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.opbatch.batcher.config.BatcherConfig;
import sh.opbatch.batcher.policy.Policy;
import sh.opbatch.batcher.queue.JsonFileQueueStore;
import sh.opbatch.batcher.queue.QueueStore;
import sh.opbatch.batcher.ratelimit.JsonFileRateWindowStore;
import sh.opbatch.batcher.ratelimit.RateLimiter;
import sh.opbatch.batcher.select.BatchSelector;
import sh.opbatch.batcher.select.Selection;
import sh.opbatch.batcher.submit.SubmissionPipeline;
import sh.opbatch.core.error.EstimationException;
import sh.opbatch.core.error.QueueStoreException;
import sh.opbatch.core.model.GasFees;
import sh.opbatch.core.model.QueueEntry;
import sh.opbatch.core.model.UserOperation;
import sh.opbatch.rpc.BundleReceipt;
import sh.opbatch.rpc.BundlerClient;
import sh.opbatch.rpc.FeeEstimator;
import sh.opbatch.rpc.Sleeper;
import sh.opbatch.rpc.exception.RetryExhaustedException;

/**
 * One pass over the queue: load, select, backfill fees, submit, persist.
 *
 * <pre>{@code
 * BatchRun run = BatchRun.create(config, Policy.defaults(), BundlerClient.from(provider),
 *         Sleeper.SYSTEM, Clock.systemUTC());
 * RunOutcome outcome = run.run();
 * }</pre>
 */
public final class BatchRun {

    private static final Logger log = LoggerFactory.getLogger(BatchRun.class);

    private final BatcherConfig config;
    private final Policy policy;
    private final QueueStore queueStore;
    private final RateLimiter rateLimiter;
    private final FeeEstimator feeEstimator;
    private final SubmissionPipeline pipeline;

    BatchRun(
            final BatcherConfig config,
            final Policy policy,
            final QueueStore queueStore,
            final RateLimiter rateLimiter,
            final FeeEstimator feeEstimator,
            final SubmissionPipeline pipeline) {
        this.config = Objects.requireNonNull(config, "config");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.feeEstimator = Objects.requireNonNull(feeEstimator, "feeEstimator");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    /**
     * Wires a run over the JSON file stores named in {@code config}.
     *
     * @throws QueueStoreException if the rate window file exists but cannot be read
     */
    public static BatchRun create(
            final BatcherConfig config,
            final Policy policy,
            final BundlerClient client,
            final Sleeper sleeper,
            final Clock clock) {
        final QueueStore queueStore = new JsonFileQueueStore(config.queueFile());
        final RateLimiter rateLimiter =
                new RateLimiter(new JsonFileRateWindowStore(config.rateStateFile()), config.window(), clock);
        return new BatchRun(
                config,
                policy,
                queueStore,
                rateLimiter,
                new FeeEstimator(client),
                new SubmissionPipeline(client, queueStore, rateLimiter, config.retry(), sleeper));
    }

    /**
     * @return what the run did
     * @throws QueueStoreException     if the queue or rate window file cannot be read or written
     * @throws EstimationException     if fees were needed and could not be estimated
     * @throws RetryExhaustedException if the relay rejected every submission attempt
     */
    public RunOutcome run() {
        final List<QueueEntry> queue = queueStore.load();
        if (queue.isEmpty()) {
            log.info("Queue empty. Nothing to do.");
            return new RunOutcome.NoOp();
        }

        final Selection selection = BatchSelector.select(
                queue, policy, rateLimiter::alreadySent, config.maxPerTargetPerWindow());
        log.info("Selected {} to send, {} retained, {} dropped",
                selection.toSend().size(), selection.retained().size(), selection.dropped().size());

        if (selection.toSend().isEmpty()) {
            if (selection.hasDropped() && !config.dryRun()) {
                queueStore.save(selection.remainingWith(queueStore.load()));
                log.info("Nothing selected for sending. Removed {} invalid entries.", selection.dropped().size());
            } else {
                log.info("Nothing selected for sending. Queue unchanged.");
            }
            return new RunOutcome.NoOp();
        }

        final List<UserOperation> operations = withFees(selection.operations());

        if (config.dryRun()) {
            log.info("Dry-run: would send {} ops.", operations.size());
            return new RunOutcome.DryRun(operations.size());
        }

        final BundleReceipt receipt = pipeline.submit(selection, operations, config.entryPoint());
        return new RunOutcome.Sent(operations.size(), receipt);
    }

    private List<UserOperation> withFees(final List<UserOperation> operations) {
        boolean needsFees = false;
        for (UserOperation op : operations) {
            if (op.hasUnsetFees()) {
                needsFees = true;
                break;
            }
        }
        if (!needsFees) {
            return operations;
        }
        final GasFees fees = feeEstimator.estimate();
        log.debug("Estimated fees: maxFeePerGas={} maxPriorityFeePerGas={}",
                fees.maxFeePerGas().value(), fees.maxPriorityFeePerGas().value());
        final List<UserOperation> filled = new ArrayList<>(operations.size());
        for (UserOperation op : operations) {
            filled.add(op.withDefaultFees(fees));
        }
        return filled;
    }
}
