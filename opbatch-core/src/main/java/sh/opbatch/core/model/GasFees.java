// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.model;

import java.util.Objects;

import sh.opbatch.core.types.Wei;

/**
 * EIP-1559 fee pair used to backfill operations that were enqueued without fees.
 *
 * @param maxFeePerGas         maximum total fee per gas
 * @param maxPriorityFeePerGas maximum tip per gas
 */
public record GasFees(Wei maxFeePerGas, Wei maxPriorityFeePerGas) {

    public GasFees {
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas");
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas");
    }
}
