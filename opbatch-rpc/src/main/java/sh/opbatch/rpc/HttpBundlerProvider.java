// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import sh.opbatch.core.DebugLogger;
import sh.opbatch.core.LogFormatter;
import sh.opbatch.core.error.RpcException;
import sh.opbatch.rpc.internal.RpcUtils;

/**
 * JSON-RPC over HTTP(S) using the JDK {@link HttpClient}.
 *
 * <p>
 * Every failure surfaces as an {@link RpcException}: network errors use code
 * {@code -32000}, non-2xx statuses {@code -32001}, serialization and parse failures
 * {@code -32700}, and relay error objects keep the relay's code. With debug tracing
 * on, each call logs one timing line (or one error line); request bodies are not traced.
 */
public final class HttpBundlerProvider implements BundlerProvider {

    private static final int NETWORK_ERROR = -32000;
    private static final int HTTP_ERROR = -32001;
    private static final int PARSE_ERROR = -32700;

    private final RpcConfig config;
    private final HttpClient httpClient;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpBundlerProvider(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request = new JsonRpcRequest(
                "2.0", method, params == null ? List.of() : params, String.valueOf(requestId));

        final long start = System.nanoTime();
        final HttpResponse<String> response = post(request, requestId);
        final long micros = (System.nanoTime() - start) / 1_000L;

        final int status = response.statusCode();
        if (status / 100 != 2) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, status, "HTTP " + status, micros));
            throw new RpcException(
                    HTTP_ERROR, "HTTP error for method " + method + ": " + status, response.body(), requestId, null);
        }

        final JsonRpcResponse decoded = decode(method, response.body(), requestId);
        final JsonRpcError err = decoded.error();
        if (err != null) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), micros));
            throw new RpcException(err.code(), err.message(), RpcUtils.extractErrorData(err.data()), requestId);
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(method, micros));
        return decoded;
    }

    private HttpResponse<String> post(final JsonRpcRequest request, final long requestId) throws RpcException {
        final String payload;
        try {
            payload = RpcUtils.MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    PARSE_ERROR, "Unable to serialize JSON-RPC request for " + request.method(), null, requestId, e);
        }

        final HttpRequest.Builder http = HttpRequest.newBuilder(URI.create(config.url()))
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        config.headers().forEach(http::header);

        try {
            return httpClient.send(http.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(NETWORK_ERROR, "Network error during JSON-RPC call", null, requestId, e);
        } catch (IOException e) {
            throw new RpcException(NETWORK_ERROR, "Network error during JSON-RPC call", null, requestId, e);
        }
    }

    private static JsonRpcResponse decode(final String method, final String body, final long requestId)
            throws RpcException {
        final JsonRpcResponse parsed;
        try {
            parsed = RpcUtils.MAPPER.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    PARSE_ERROR, "Unable to parse JSON-RPC response for method " + method, body, requestId, e);
        }
        if (parsed == null) {
            throw new RpcException(PARSE_ERROR, "Empty JSON-RPC response for method " + method, body, requestId);
        }
        return parsed;
    }

    /**
     * Collects the relay URL, timeouts and extra headers. Unset timeouts fall back to
     * the {@link RpcConfig} defaults.
     */
    public static final class Builder {
        private final String url;
        private Duration connectTimeout;
        private Duration readTimeout;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpBundlerProvider build() {
            return new HttpBundlerProvider(new RpcConfig(url, connectTimeout, readTimeout, headers));
        }
    }
}
