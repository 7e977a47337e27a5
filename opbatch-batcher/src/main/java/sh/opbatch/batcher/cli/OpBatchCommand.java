// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import sh.opbatch.batcher.BatchRun;
import sh.opbatch.batcher.RunOutcome;
import sh.opbatch.batcher.config.BatcherConfig;
import sh.opbatch.batcher.policy.Policy;
import sh.opbatch.batcher.policy.PolicyFile;
import sh.opbatch.core.OpBatchDebug;
import sh.opbatch.core.error.EstimationException;
import sh.opbatch.core.error.OpBatchException;
import sh.opbatch.core.error.QueueStoreException;
import sh.opbatch.core.types.Address;
import sh.opbatch.rpc.BundlerClient;
import sh.opbatch.rpc.BundlerProvider;
import sh.opbatch.rpc.HttpBundlerProvider;
import sh.opbatch.rpc.RpcRetryConfig;
import sh.opbatch.rpc.Sleeper;
import sh.opbatch.rpc.exception.RetryExhaustedException;

@Command(
        name = "opbatch",
        mixinStandardHelpOptions = true,
        version = "opbatch 0.1.0",
        description = "Drain the user operation queue into a single bundle"
)
public final class OpBatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OpBatchCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_RETRIES_EXHAUSTED = 1;
    public static final int EXIT_ESTIMATION_FAILED = 2;
    public static final int EXIT_STORE_FAILED = 3;
    public static final int EXIT_ABORTED = 4;
    public static final int EXIT_USAGE = 64;

    @Spec
    CommandSpec spec;

    @Option(names = {"--bundler"}, description = "Relay JSON-RPC URL", defaultValue = BatcherConfig.DEFAULT_BUNDLER_URL)
    String bundler;

    @Option(names = {"--entrypoint"}, description = "EntryPoint contract address",
            defaultValue = "0x0576a174D229E3cFA37253523E645A78A0C91B57")
    String entryPoint;

    @Option(names = {"--queue"}, description = "Queue file", defaultValue = "queue.json")
    Path queue;

    @Option(names = {"--rate-state"}, description = "Rate window file (default: <queue>.ratelimit.json)")
    Path rateState;

    @Option(names = {"--max-per-target"}, description = "Max operations per target per window", defaultValue = "20")
    int maxPerTarget;

    @Option(names = {"--window-seconds"}, description = "Rate window length in seconds", defaultValue = "60")
    long windowSeconds;

    @Option(names = {"--max-attempts"}, description = "Submission attempts before giving up", defaultValue = "5")
    int maxAttempts;

    @Option(names = {"--policy"}, description = "JSON policy file")
    Path policyFile;

    @Option(names = {"--dry-run"}, description = "Select and estimate only, send nothing")
    boolean dryRun;

    @Option(names = {"--debug"}, description = "Trace relay requests")
    boolean debug;

    private final Sleeper sleeper;
    private final Clock clock;

    public OpBatchCommand() {
        this(Sleeper.SYSTEM, Clock.systemUTC());
    }

    OpBatchCommand(final Sleeper sleeper, final Clock clock) {
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Returns a command line for {@code command} with the exit code mapping used by {@code main}.
     */
    public static CommandLine commandLine(final OpBatchCommand command) {
        final CommandLine commandLine = new CommandLine(command);
        commandLine.getCommandSpec().exitCodeOnInvalidInput(EXIT_USAGE);
        return commandLine;
    }

    @Override
    public Integer call() {
        OpBatchDebug.setEnabled(debug);
        final BatcherConfig config = config();
        final Policy policy = policy();

        try (BundlerProvider provider = HttpBundlerProvider.builder(config.bundlerUrl()).build()) {
            final RunOutcome outcome =
                    BatchRun.create(config, policy, BundlerClient.from(provider), sleeper, clock).run();
            spec.commandLine().getOut().println(describe(outcome));
            return EXIT_OK;
        } catch (RetryExhaustedException e) {
            log.error("Failed to send after {} attempts; queue preserved. Last error: {}",
                    e.getAttemptCount(), e.getCause().getMessage());
            return EXIT_RETRIES_EXHAUSTED;
        } catch (EstimationException e) {
            log.error("{}; queue preserved.", e.getMessage());
            return EXIT_ESTIMATION_FAILED;
        } catch (QueueStoreException e) {
            log.error(e.getMessage(), e);
            return EXIT_STORE_FAILED;
        } catch (OpBatchException e) {
            // an interrupt during backoff surfaces the last relay failure
            log.error("Run aborted{}; queue preserved. Last error: {}",
                    Thread.currentThread().isInterrupted() ? " by interrupt" : "", e.getMessage());
            return EXIT_ABORTED;
        }
    }

    private BatcherConfig config() {
        try {
            return BatcherConfig.builder()
                    .bundlerUrl(bundler)
                    .entryPoint(new Address(entryPoint))
                    .queueFile(queue)
                    .rateStateFile(rateState)
                    .maxPerTargetPerWindow(maxPerTarget)
                    .window(Duration.ofSeconds(windowSeconds))
                    .dryRun(dryRun)
                    .retry(RpcRetryConfig.builder().maxAttempts(maxAttempts).build())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private Policy policy() {
        if (policyFile == null) {
            return Policy.defaults();
        }
        try {
            return PolicyFile.load(policyFile);
        } catch (IOException | IllegalArgumentException e) {
            throw new ParameterException(
                    spec.commandLine(), "Invalid policy file " + policyFile + ": " + e.getMessage(), e);
        }
    }

    private static String describe(final RunOutcome outcome) {
        if (outcome instanceof RunOutcome.Sent sent) {
            return "Bundle sent (" + sent.count() + " ops): " + sent.receipt();
        }
        if (outcome instanceof RunOutcome.DryRun dry) {
            return "Dry-run: would send " + dry.count() + " ops.";
        }
        return "Nothing to send.";
    }
}
