// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.policy;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.opbatch.batcher.Fixtures;
import sh.opbatch.core.model.UserOperation;
import sh.opbatch.core.types.Wei;

class PolicyValidatorTest {

    private static UserOperation withFees(final String maxFee, final String maxPriorityFee) {
        return UserOperation.fromRpcObject(Map.of(
                "sender", Fixtures.SENDER.value(),
                "nonce", "0x1",
                "callData", "0x",
                "callGasLimit", "0x5208",
                "verificationGasLimit", "0x5208",
                "preVerificationGas", "0x5208",
                "maxFeePerGas", maxFee,
                "maxPriorityFeePerGas", maxPriorityFee,
                "signature", "0x01"));
    }

    @Test
    void admitsOperationWithinDefaults() {
        assertTrue(PolicyValidator.validate(Fixtures.op(1), Policy.defaults()).isEmpty());
    }

    @Test
    void comparesFeesNumerically() {
        Policy policy = Policy.builder().maxFeePerGas(Wei.of(5)).maxPriorityFeePerGas(Wei.of(5)).build();

        List<String> errors = PolicyValidator.validate(withFees("0xa", "0x1"), policy);

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("maxFeePerGas too high: 10 > 5"));
    }

    @Test
    void shorterHexIsNotGreaterThanLongerHex() {
        Policy policy = Policy.builder().maxFeePerGas(Wei.of(0x10)).maxPriorityFeePerGas(Wei.of(0x10)).build();

        assertTrue(PolicyValidator.validate(withFees("0x9", "0x9"), policy).isEmpty());
        assertEquals(2, PolicyValidator.validate(withFees("0x11", "0x100"), policy).size());
    }

    @Test
    void reportsEveryViolation() {
        Policy policy = Policy.builder()
                .maxCallGas(BigInteger.valueOf(50_000))
                .maxFeePerGas(Wei.gwei(10))
                .maxPriorityFeePerGas(Wei.gwei(1))
                .build();
        UserOperation op = new UserOperation(
                Fixtures.SENDER,
                BigInteger.ONE,
                Fixtures.unsignedDeployment(1).initCode(),
                null,
                BigInteger.valueOf(100_000),
                BigInteger.valueOf(100_000),
                BigInteger.valueOf(21_000),
                Wei.gwei(11),
                Wei.gwei(2),
                null,
                null);

        List<String> errors = PolicyValidator.validate(op, policy);

        assertEquals(4, errors.size());
        assertTrue(errors.get(0).startsWith("callGasLimit too high"));
        assertTrue(errors.get(1).startsWith("maxFeePerGas too high"));
        assertTrue(errors.get(2).startsWith("maxPriorityFeePerGas too high"));
        assertEquals(PolicyValidator.LIKELY_INVALID, errors.get(3));
    }

    @Test
    void limitsAreInclusive() {
        Policy policy = Policy.defaults();
        UserOperation atLimit = new UserOperation(
                Fixtures.SENDER,
                BigInteger.ONE,
                null,
                null,
                Policy.DEFAULT_MAX_CALL_GAS,
                BigInteger.ONE,
                BigInteger.ONE,
                Policy.DEFAULT_MAX_FEE_PER_GAS,
                Policy.DEFAULT_MAX_PRIORITY_FEE_PER_GAS,
                null,
                null);

        assertTrue(PolicyValidator.validate(atLimit, policy).isEmpty());
    }

    @Test
    void unsignedDeploymentIsLikelyInvalid() {
        assertEquals(
                List.of(PolicyValidator.LIKELY_INVALID),
                PolicyValidator.validate(Fixtures.unsignedDeployment(3), Policy.defaults()));
    }
}
