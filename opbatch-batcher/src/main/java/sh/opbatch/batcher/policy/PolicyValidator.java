// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.opbatch.core.model.UserOperation;

/**
 * Checks one operation against a {@link Policy}.
 *
 * <p>
 * Every rule is evaluated, so the result lists all violations at once. Fee limits are
 * compared as numbers in wei.
 */
public final class PolicyValidator {

    public static final String LIKELY_INVALID = "initCode present but signature empty (likely invalid)";

    private PolicyValidator() {
    }

    /**
     * @param op     operation to check
     * @param policy limits to apply
     * @return violation messages; empty when the operation is admitted
     */
    public static List<String> validate(final UserOperation op, final Policy policy) {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(policy, "policy");
        final List<String> errors = new ArrayList<>();
        if (op.callGasLimit().compareTo(policy.maxCallGas()) > 0) {
            errors.add("callGasLimit too high: " + op.callGasLimit() + " > " + policy.maxCallGas());
        }
        if (op.maxFeePerGas().isGreaterThan(policy.maxFeePerGas())) {
            errors.add("maxFeePerGas too high: " + op.maxFeePerGas().value()
                    + " > " + policy.maxFeePerGas().value());
        }
        if (op.maxPriorityFeePerGas().isGreaterThan(policy.maxPriorityFeePerGas())) {
            errors.add("maxPriorityFeePerGas too high: " + op.maxPriorityFeePerGas().value()
                    + " > " + policy.maxPriorityFeePerGas().value());
        }
        if (!op.initCode().isEmpty() && op.signature().isEmpty()) {
            errors.add(LIKELY_INVALID);
        }
        return errors;
    }
}
