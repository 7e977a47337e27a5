// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.error;

/**
 * Thrown when the relay's fee level cannot be obtained or parsed.
 *
 * <p>
 * Fatal to a run: no submission is attempted and the queue is left untouched.
 * Callers must not substitute a default fee.
 */
public final class EstimationException extends OpBatchException {

    public EstimationException(final String message) {
        super(message);
    }

    public EstimationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
