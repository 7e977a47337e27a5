// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher;

import sh.opbatch.rpc.BundleReceipt;

/**
 * Result of a {@link BatchRun} that did not fail.
 */
public sealed interface RunOutcome permits RunOutcome.NoOp, RunOutcome.DryRun, RunOutcome.Sent {

    /** Nothing to send: the queue was empty or no entry was admitted. */
    record NoOp() implements RunOutcome {
    }

    /** Dry run; {@code count} operations would have been sent. */
    record DryRun(int count) implements RunOutcome {
    }

    /** A bundle of {@code count} operations was accepted by the relay. */
    record Sent(int count, BundleReceipt receipt) implements RunOutcome {
    }
}
