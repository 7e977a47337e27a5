// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Represents a JSON-RPC 2.0 response from the relay.
 * <p>
 * This record holds either a successful result or an error. Use {@link #hasError()}
 * to check which is present.
 *
 * @param jsonrpc the JSON-RPC version (always "2.0")
 * @param result the result object if successful, or {@code null} if error
 * @param error the error object if failed, or {@code null} if successful
 * @param id the request ID that this response corresponds to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        String id) {

    /**
     * Checks if this response contains an error.
     *
     * @return {@code true} if the response has an error, {@code false} otherwise
     */
    public boolean hasError() {
        return error != null;
    }

    /**
     * Returns the result as a String.
     * <p>
     * This is useful for RPC methods that return hex-encoded values (e.g., eth_gasPrice).
     *
     * @return the result as a string, or {@code null} if result is null
     */
    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }
}
