// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import java.util.Objects;

/**
 * Opaque acknowledgement returned by the relay for an accepted bundle.
 *
 * <p>
 * String results (typically a bundle or transaction hash) are kept verbatim; structured
 * results are kept as their compact JSON text.
 *
 * @param value the relay's result
 */
public record BundleReceipt(String value) {

    public BundleReceipt {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
