// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher;

import java.math.BigInteger;

import sh.opbatch.core.model.QueueEntry;
import sh.opbatch.core.model.UserOperation;
import sh.opbatch.core.types.Address;
import sh.opbatch.core.types.HexData;
import sh.opbatch.core.types.Wei;

/**
 * Queue entries for batcher tests.
 */
public final class Fixtures {

    public static final Address TARGET_X = new Address("0x" + "1".repeat(40));
    public static final Address TARGET_Y = new Address("0x" + "2".repeat(40));
    public static final Address SENDER = new Address("0x" + "a".repeat(40));

    private Fixtures() {
    }

    /** A deployed-account operation with the given fees and a non-empty signature. */
    public static UserOperation op(final long nonce, final Wei maxFee, final Wei maxPriorityFee) {
        return new UserOperation(
                SENDER,
                BigInteger.valueOf(nonce),
                HexData.EMPTY,
                new HexData("0xb61d27f6"),
                BigInteger.valueOf(100_000),
                BigInteger.valueOf(150_000),
                BigInteger.valueOf(21_000),
                maxFee,
                maxPriorityFee,
                HexData.EMPTY,
                new HexData("0x" + "ab".repeat(65)));
    }

    public static UserOperation op(final long nonce) {
        return op(nonce, Wei.gwei(50), Wei.gwei(2));
    }

    /** An operation that deploys its account but carries no signature. */
    public static UserOperation unsignedDeployment(final long nonce) {
        return new UserOperation(
                SENDER,
                BigInteger.valueOf(nonce),
                new HexData("0x" + "9".repeat(40) + "5fbfb9cf"),
                new HexData("0xb61d27f6"),
                BigInteger.valueOf(100_000),
                BigInteger.valueOf(400_000),
                BigInteger.valueOf(21_000),
                Wei.gwei(50),
                Wei.gwei(2),
                HexData.EMPTY,
                HexData.EMPTY);
    }

    public static QueueEntry entry(final UserOperation op, final Address target, final String session) {
        return new QueueEntry(op, target, session, 1_700_000_000L + op.nonce().longValue());
    }

    public static QueueEntry entry(final long nonce, final Address target) {
        return entry(op(nonce), target, "s" + nonce);
    }
}
