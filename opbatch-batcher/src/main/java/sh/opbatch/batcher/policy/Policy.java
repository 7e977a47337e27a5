// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.policy;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import sh.opbatch.core.types.Address;
import sh.opbatch.core.types.Wei;

/**
 * Admission limits applied to every queued operation.
 *
 * <p>
 * Instances are immutable and are passed explicitly to {@link PolicyValidator} and
 * the batch selector.
 *
 * <pre>{@code
 * Policy policy = Policy.builder()
 *     .blockTarget(new Address("0x..."))
 *     .maxFeePerGas(Wei.gwei(150))
 *     .build();
 * }</pre>
 *
 * @param blockedTargets       targets whose operations are held back
 * @param maxCallGas           ceiling for {@code callGasLimit}
 * @param maxFeePerGas         ceiling for {@code maxFeePerGas}
 * @param maxPriorityFeePerGas ceiling for {@code maxPriorityFeePerGas}
 */
public record Policy(
        Set<Address> blockedTargets,
        BigInteger maxCallGas,
        Wei maxFeePerGas,
        Wei maxPriorityFeePerGas) {

    public static final BigInteger DEFAULT_MAX_CALL_GAS = BigInteger.valueOf(6_000_000L);
    public static final Wei DEFAULT_MAX_FEE_PER_GAS = Wei.gwei(200);
    public static final Wei DEFAULT_MAX_PRIORITY_FEE_PER_GAS = Wei.gwei(20);

    public Policy {
        blockedTargets = Set.copyOf(Objects.requireNonNull(blockedTargets, "blockedTargets"));
        Objects.requireNonNull(maxCallGas, "maxCallGas");
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas");
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas");
        if (maxCallGas.signum() < 0) {
            throw new IllegalArgumentException("maxCallGas must be non-negative");
        }
    }

    /**
     * Returns the default policy: nothing blocked, 6,000,000 call gas, 200 gwei max fee,
     * 20 gwei priority fee.
     */
    public static Policy defaults() {
        return builder().build();
    }

    public boolean isBlocked(final Address target) {
        return blockedTargets.contains(target);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<Address> blockedTargets = new LinkedHashSet<>();
        private BigInteger maxCallGas = DEFAULT_MAX_CALL_GAS;
        private Wei maxFeePerGas = DEFAULT_MAX_FEE_PER_GAS;
        private Wei maxPriorityFeePerGas = DEFAULT_MAX_PRIORITY_FEE_PER_GAS;

        private Builder() {}

        public Builder blockTarget(final Address target) {
            blockedTargets.add(Objects.requireNonNull(target, "target"));
            return this;
        }

        public Builder maxCallGas(final BigInteger maxCallGas) {
            this.maxCallGas = maxCallGas;
            return this;
        }

        public Builder maxFeePerGas(final Wei maxFeePerGas) {
            this.maxFeePerGas = maxFeePerGas;
            return this;
        }

        public Builder maxPriorityFeePerGas(final Wei maxPriorityFeePerGas) {
            this.maxPriorityFeePerGas = maxPriorityFeePerGas;
            return this;
        }

        public Policy build() {
            return new Policy(blockedTargets, maxCallGas, maxFeePerGas, maxPriorityFeePerGas);
        }
    }
}
