// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.opbatch.core.error.RpcException;

class HttpBundlerProviderTest {

    private HttpServer server;
    private URI baseUri;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void sendSuccessResponse() {
        server.createContext(
                "/",
                exchange ->
                        respond(
                                exchange,
                                200,
                                """
                                {"jsonrpc":"2.0","result":"0x3b9aca00","id":"1"}
                                """));

        BundlerProvider provider = HttpBundlerProvider.builder(baseUri.toString()).build();
        JsonRpcResponse response = provider.send("eth_gasPrice", List.of());
        assertEquals("0x3b9aca00", response.result());
        assertNull(response.error());
    }

    @Test
    void postsJsonRpcEnvelopeWithCustomHeaders() {
        final AtomicReference<String> body = new AtomicReference<>();
        final AtomicReference<String> apiKey = new AtomicReference<>();
        server.createContext(
                "/",
                exchange -> {
                    body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                    apiKey.set(exchange.getRequestHeaders().getFirst("X-Api-Key"));
                    respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":\"0xabc\",\"id\":\"1\"}");
                });

        BundlerProvider provider = HttpBundlerProvider.builder(baseUri.toString())
                .header("X-Api-Key", "secret")
                .build();
        provider.send("eth_sendUserOperationBundle", List.of(List.of(), "0x" + "1".repeat(40)));

        assertEquals("secret", apiKey.get());
        assertTrue(body.get().contains("\"jsonrpc\":\"2.0\""));
        assertTrue(body.get().contains("\"method\":\"eth_sendUserOperationBundle\""));
        assertTrue(body.get().contains("\"params\":[[],\"0x1111111111111111111111111111111111111111\"]"));
    }

    @Test
    void jsonRpcErrorThrows() {
        server.createContext(
                "/",
                exchange -> {
                    respond(
                            exchange,
                            200,
                            """
                            {"jsonrpc":"2.0","error":{"code":-32602,"message":"invalid bundle","data":{"reason":"AA21"}},"id":"1"}
                            """);
                });

        BundlerProvider provider = HttpBundlerProvider.builder(baseUri.toString()).build();
        RpcException ex =
                assertThrows(
                        RpcException.class,
                        () -> provider.send("eth_sendUserOperationBundle", List.of()));
        assertEquals(-32602, ex.code());
        assertEquals("AA21", ex.data());
        assertTrue(ex.getMessage().contains("invalid bundle"));
    }

    @Test
    void httpErrorThrows() {
        server.createContext("/", exchange -> respond(exchange, 502, "bad gateway"));

        BundlerProvider provider = HttpBundlerProvider.builder(baseUri.toString()).build();
        RpcException ex =
                assertThrows(
                        RpcException.class,
                        () -> provider.send("eth_gasPrice", List.of()));
        assertEquals(-32001, ex.code());
        assertEquals("bad gateway", ex.data());
    }

    @Test
    void malformedBodyThrowsParseError() {
        server.createContext("/", exchange -> respond(exchange, 200, "not json"));

        BundlerProvider provider = HttpBundlerProvider.builder(baseUri.toString()).build();
        RpcException ex =
                assertThrows(
                        RpcException.class,
                        () -> provider.send("eth_gasPrice", List.of()));
        assertEquals(-32700, ex.code());
    }

    @Test
    void connectionRefusedThrowsNetworkError() throws IOException {
        final int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        BundlerProvider provider = HttpBundlerProvider.builder("http://127.0.0.1:" + closedPort).build();
        RpcException ex =
                assertThrows(
                        RpcException.class,
                        () -> provider.send("eth_gasPrice", List.of()));
        assertEquals(-32000, ex.code());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    private void respond(final HttpExchange exchange, final int statusCode, final String body)
            throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
