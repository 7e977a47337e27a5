// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.policy;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Set;

import sh.opbatch.batcher.internal.Jsons;
import sh.opbatch.core.types.Address;
import sh.opbatch.core.types.Wei;
import sh.opbatch.primitives.Hex;

/**
 * Reads a {@link Policy} from a JSON object.
 *
 * <pre>{@code
 * {
 *   "blockedTargets": ["0x..."],
 *   "maxCallGas": 6000000,
 *   "maxFeePerGasGwei": 200,
 *   "maxPriorityFeePerGasGwei": 20
 * }
 * }</pre>
 *
 * Absent keys keep their default; unknown keys are rejected.
 */
public final class PolicyFile {

    static final String BLOCKED_TARGETS = "blockedTargets";
    static final String MAX_CALL_GAS = "maxCallGas";
    static final String MAX_FEE_GWEI = "maxFeePerGasGwei";
    static final String MAX_PRIORITY_FEE_GWEI = "maxPriorityFeePerGasGwei";

    private static final Set<String> KEYS = Set.of(BLOCKED_TARGETS, MAX_CALL_GAS, MAX_FEE_GWEI, MAX_PRIORITY_FEE_GWEI);

    private PolicyFile() {
    }

    /**
     * @param file JSON policy file
     * @return the policy
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if the JSON does not describe a valid policy
     */
    public static Policy load(final Path file) throws IOException {
        final JsonNode root = Jsons.mapper().readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Policy file must hold a JSON object: " + file);
        }
        final Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            final String name = names.next();
            if (!KEYS.contains(name)) {
                throw new IllegalArgumentException("Unknown policy key '" + name + "' in " + file);
            }
        }

        final Policy.Builder builder = Policy.builder();
        final JsonNode blocked = root.get(BLOCKED_TARGETS);
        if (blocked != null) {
            if (!blocked.isArray()) {
                throw new IllegalArgumentException("'" + BLOCKED_TARGETS + "' must be an array of addresses");
            }
            for (JsonNode target : blocked) {
                builder.blockTarget(new Address(target.asText()));
            }
        }
        if (root.has(MAX_CALL_GAS)) {
            builder.maxCallGas(quantity(root.get(MAX_CALL_GAS), MAX_CALL_GAS));
        }
        if (root.has(MAX_FEE_GWEI)) {
            builder.maxFeePerGas(gwei(root.get(MAX_FEE_GWEI), MAX_FEE_GWEI));
        }
        if (root.has(MAX_PRIORITY_FEE_GWEI)) {
            builder.maxPriorityFeePerGas(gwei(root.get(MAX_PRIORITY_FEE_GWEI), MAX_PRIORITY_FEE_GWEI));
        }
        return builder.build();
    }

    private static BigInteger quantity(final JsonNode node, final String key) {
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isTextual()) {
            return Hex.decodeQuantity(node.asText());
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer, got " + node);
    }

    private static Wei gwei(final JsonNode node, final String key) {
        final BigInteger amount = quantity(node, key);
        return Wei.of(amount.multiply(BigInteger.valueOf(1_000_000_000L)));
    }
}
