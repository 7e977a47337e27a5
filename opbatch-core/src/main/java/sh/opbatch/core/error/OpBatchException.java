// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.error;

/**
 * Base runtime exception for all opbatch failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * OpBatchException
 * ├── {@link RpcException} - JSON-RPC communication failures
 * ├── {@link EstimationException} - fee estimation failures (run aborts before submission)
 * └── {@link QueueStoreException} - queue or rate window file cannot be read or written
 * </pre>
 *
 * <p>
 * Policy violations are not exceptions: they are reported as reason strings and the
 * offending entry is dropped without interrupting the run.
 *
 * @since 0.1.0
 */
public sealed class OpBatchException extends RuntimeException
        permits RpcException,
        EstimationException,
        QueueStoreException {

    public OpBatchException(final String message) {
        super(message);
    }

    public OpBatchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
