// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import java.util.List;

import sh.opbatch.core.error.RpcException;

/**
 * Low-level abstraction for sending JSON-RPC requests to a bundler relay.
 *
 * <p>
 * This interface abstracts the transport from the RPC business logic. Implementations handle:
 * <ul>
 * <li>Serializing requests to JSON</li>
 * <li>Sending requests over the wire</li>
 * <li>Deserializing responses from JSON</li>
 * <li>Turning transport failures and JSON-RPC error objects into {@link RpcException}</li>
 * </ul>
 *
 * <p>
 * Implementations do not retry; retry policy belongs to the caller (see {@link RpcRetry}).
 *
 * @see HttpBundlerProvider
 * @see BundlerClient#from(BundlerProvider)
 */
public interface BundlerProvider extends AutoCloseable {

    /**
     * Sends a JSON-RPC request.
     *
     * @param method the JSON-RPC method name
     * @param params the list of parameters
     * @return the JSON-RPC response, never one carrying an error
     * @throws RpcException if the request fails or returns an error
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    /**
     * Closes this provider and releases any associated resources.
     * <p>
     * The default implementation does nothing.
     */
    @Override
    default void close() {
        // Default no-op for providers that don't need cleanup
    }
}
