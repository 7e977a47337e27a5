// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.error;

/**
 * Exception thrown when a JSON-RPC request to the relay fails.
 *
 * <p>
 * Covers transport failures, non-2xx HTTP statuses and JSON-RPC error objects.
 *
 * <p>
 * <strong>Codes used for local failures:</strong>
 * <ul>
 * <li><strong>-32700</strong>: request could not be serialized, or response could not be parsed</li>
 * <li><strong>-32000</strong>: network error (connection refused, reset, timeout)</li>
 * <li><strong>-32001</strong>: non-2xx HTTP status</li>
 * </ul>
 * Any other code is the one reported by the relay.
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends OpBatchException {

    private final int code;
    private final String data;
    private final Long requestId;

    public RpcException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final String data, final Long requestId) {
        this(code, message, data, requestId, null);
    }

    public int code() {
        return code;
    }

    public String data() {
        return data;
    }

    public Long requestId() {
        return requestId;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
