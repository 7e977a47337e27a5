// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import java.math.BigInteger;
import java.util.Objects;

import sh.opbatch.core.error.EstimationException;
import sh.opbatch.core.error.RpcException;
import sh.opbatch.core.model.GasFees;
import sh.opbatch.core.types.Wei;

/**
 * Derives default EIP-1559 fees from the relay's current base fee.
 *
 * <p>The estimate is a fixed markup over one {@code eth_gasPrice} reading:
 * {@code maxFeePerGas = base * 2} and {@code maxPriorityFeePerGas = base / 10}
 * (integer division). It only fills fields an operation left at zero.</p>
 */
public final class FeeEstimator {

    static final BigInteger BASE_FEE_MULTIPLIER = BigInteger.valueOf(2);
    static final BigInteger PRIORITY_FEE_DIVISOR = BigInteger.TEN;

    private final BundlerClient client;

    public FeeEstimator(final BundlerClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Queries the relay once and applies the markup.
     *
     * @return the suggested fees
     * @throws EstimationException if the query fails or returns a non-numeric result
     */
    public GasFees estimate() {
        final Wei base;
        try {
            base = client.gasPrice();
        } catch (RpcException e) {
            throw new EstimationException("Fee estimation failed: " + e.getMessage(), e);
        }
        if (base == null) {
            throw new EstimationException("Fee estimation failed: relay returned no base fee");
        }
        return new GasFees(
                new Wei(base.value().multiply(BASE_FEE_MULTIPLIER)),
                new Wei(base.value().divide(PRIORITY_FEE_DIVISOR)));
    }
}
