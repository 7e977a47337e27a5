// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import java.util.List;

import sh.opbatch.core.error.RpcException;
import sh.opbatch.core.model.UserOperation;
import sh.opbatch.core.types.Address;
import sh.opbatch.core.types.Wei;

/**
 * The two relay calls the batcher depends on.
 *
 * <p>
 * Neither call retries. Callers decide whether a failure is fatal (fee query) or
 * retryable (bundle submission).
 *
 * <pre>{@code
 * BundlerClient client = BundlerClient.from(HttpBundlerProvider.builder("http://127.0.0.1:3000").build());
 * Wei base = client.gasPrice();
 * BundleReceipt receipt = client.sendBundle(ops, entryPoint);
 * }</pre>
 */
public interface BundlerClient {

    /**
     * Queries the relay's current base fee ({@code eth_gasPrice}).
     *
     * @return the fee per gas in wei
     * @throws RpcException if the call fails or the result is not a quantity
     */
    Wei gasPrice();

    /**
     * Submits the operations as one bundle ({@code eth_sendUserOperationBundle}).
     *
     * <p>
     * The relay accepts or rejects the bundle as a whole.
     *
     * @param operations the operations, in submission order
     * @param entryPoint the EntryPoint contract the bundle targets
     * @return the relay's acknowledgement
     * @throws RpcException if the call fails or the relay reports an error
     */
    BundleReceipt sendBundle(List<UserOperation> operations, Address entryPoint);

    static BundlerClient from(final BundlerProvider provider) {
        return new DefaultBundlerClient(provider);
    }
}
