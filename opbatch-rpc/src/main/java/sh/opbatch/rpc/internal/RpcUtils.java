// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.Array;
import java.util.Map;

/**
 * Internal utility methods shared by the RPC layer.
 *
 * <p>
 * Holds the shared {@link ObjectMapper} and the JSON-RPC error data extraction used
 * when turning an error object into an {@link sh.opbatch.core.error.RpcException}.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance for JSON serialization/deserialization.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Recursively extracts error data from nested JSON-RPC error payloads.
     *
     * <p>
     * Bundlers commonly return {@code {data: {reason: "..."}}}; this flattens to the
     * first nested value found, or falls back to the string form of the whole value.
     *
     * @param dataValue the error data object from the JSON-RPC response
     * @return extracted error data string, or null if dataValue is null
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        if (dataValue.getClass().isArray()) {
            return extractFromArray(dataValue, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    private static String extractFromArray(final Object array, final Object fallback) {
        final int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            final String extracted = extractErrorData(Array.get(array, i));
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }
}
