// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.cli;

import static org.junit.jupiter.api.Assertions.*;
import static sh.opbatch.batcher.Fixtures.TARGET_X;
import static sh.opbatch.batcher.Fixtures.entry;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import sh.opbatch.batcher.Fixtures;
import sh.opbatch.batcher.queue.JsonFileQueueStore;
import sh.opbatch.core.OpBatchDebug;
import sh.opbatch.core.types.Wei;
import sh.opbatch.rpc.Sleeper;

class OpBatchCommandTest {

    @TempDir
    Path dir;

    private HttpServer server;
    private String bundlerUrl;
    private Path queueFile;
    private final List<Long> waits = new ArrayList<>();
    private final AtomicInteger gasPriceCalls = new AtomicInteger();
    private final AtomicInteger bundleCalls = new AtomicInteger();
    private final StringWriter out = new StringWriter();

    private volatile int bundleStatus = 200;
    private volatile String gasPriceResponse = "{\"jsonrpc\":\"2.0\",\"result\":\"0x3b9aca00\",\"id\":\"1\"}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", this::handle);
        server.start();
        bundlerUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        queueFile = dir.resolve("queue.json");
    }

    @AfterEach
    void tearDown() {
        Thread.interrupted();
        server.stop(0);
        OpBatchDebug.setEnabled(false);
    }

    private void handle(final HttpExchange exchange) throws IOException {
        final String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        if (body.contains("eth_gasPrice")) {
            gasPriceCalls.incrementAndGet();
            respond(exchange, 200, gasPriceResponse);
        } else {
            bundleCalls.incrementAndGet();
            respond(exchange, bundleStatus, "{\"jsonrpc\":\"2.0\",\"result\":\"0xbundlehash\",\"id\":\"1\"}");
        }
    }

    private static void respond(final HttpExchange exchange, final int status, final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private int execute(final String... extra) {
        return execute(waits::add, extra);
    }

    private int execute(final Sleeper sleeper, final String... extra) {
        final List<String> args = new ArrayList<>(List.of("--bundler", bundlerUrl, "--queue", queueFile.toString()));
        args.addAll(List.of(extra));
        final CommandLine cmd = OpBatchCommand.commandLine(new OpBatchCommand(
                sleeper, Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC)));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(new StringWriter(), true));
        return cmd.execute(args.toArray(new String[0]));
    }

    @Test
    void emptyQueueExitsCleanly() {
        assertEquals(OpBatchCommand.EXIT_OK, execute());
        assertTrue(out.toString().contains("Nothing to send."));
        assertEquals(0, gasPriceCalls.get() + bundleCalls.get());
    }

    @Test
    void sendsBundleAndClearsQueue() {
        new JsonFileQueueStore(queueFile).save(List.of(
                entry(Fixtures.op(1, Wei.ZERO, Wei.ZERO), TARGET_X, "alice"),
                entry(2, TARGET_X)));

        assertEquals(OpBatchCommand.EXIT_OK, execute());

        assertTrue(out.toString().contains("Bundle sent (2 ops): 0xbundlehash"));
        assertEquals(1, gasPriceCalls.get());
        assertEquals(1, bundleCalls.get());
        assertTrue(new JsonFileQueueStore(queueFile).load().isEmpty());
        assertTrue(Files.exists(dir.resolve("queue.json.ratelimit.json")));
    }

    @Test
    void dryRunReportsWithoutSending() {
        new JsonFileQueueStore(queueFile).save(List.of(entry(1, TARGET_X)));

        assertEquals(OpBatchCommand.EXIT_OK, execute("--dry-run"));

        assertTrue(out.toString().contains("Dry-run: would send 1 ops."));
        assertEquals(0, bundleCalls.get());
    }

    @Test
    void exhaustedRetriesExitWithOne() throws IOException {
        new JsonFileQueueStore(queueFile).save(List.of(entry(1, TARGET_X)));
        byte[] before = Files.readAllBytes(queueFile);
        bundleStatus = 503;

        assertEquals(OpBatchCommand.EXIT_RETRIES_EXHAUSTED, execute("--max-attempts", "3"));

        assertEquals(3, bundleCalls.get());
        assertEquals(List.of(2_000L, 4_000L), waits);
        assertArrayEquals(before, Files.readAllBytes(queueFile));
    }

    @Test
    void interruptDuringBackoffExitsWithAbortedCode() throws IOException {
        new JsonFileQueueStore(queueFile).save(List.of(entry(1, TARGET_X)));
        byte[] before = Files.readAllBytes(queueFile);
        bundleStatus = 503;

        final int code = execute(millis -> {
            throw new InterruptedException("shutdown");
        });
        final boolean interrupted = Thread.interrupted();

        assertEquals(OpBatchCommand.EXIT_ABORTED, code);
        assertTrue(interrupted);
        assertEquals(1, bundleCalls.get());
        assertArrayEquals(before, Files.readAllBytes(queueFile));
        assertFalse(Files.exists(dir.resolve("queue.json.ratelimit.json")));
    }

    @Test
    void estimationFailureExitsWithTwo() {
        new JsonFileQueueStore(queueFile).save(List.of(entry(Fixtures.op(1, Wei.ZERO, Wei.ZERO), TARGET_X, "a")));
        gasPriceResponse = "{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32603,\"message\":\"internal\"},\"id\":\"1\"}";

        assertEquals(OpBatchCommand.EXIT_ESTIMATION_FAILED, execute());
        assertEquals(0, bundleCalls.get());
    }

    @Test
    void unreadableQueueExitsWithThree() throws IOException {
        Files.writeString(queueFile, "[{\"op\": 1}]");

        assertEquals(OpBatchCommand.EXIT_STORE_FAILED, execute());
    }

    @Test
    void badArgumentsExitWithUsageCode() throws IOException {
        Path policy = dir.resolve("policy.json");
        Files.writeString(policy, "{\"maxFee\": 1}");

        assertEquals(OpBatchCommand.EXIT_USAGE, execute("--entrypoint", "0x1234"));
        assertEquals(OpBatchCommand.EXIT_USAGE, execute("--policy", policy.toString()));
        assertEquals(OpBatchCommand.EXIT_USAGE, execute("--max-per-target", "lots"));
    }

    @Test
    void policyFileBlocksTarget() throws IOException {
        new JsonFileQueueStore(queueFile).save(List.of(entry(1, TARGET_X)));
        byte[] before = Files.readAllBytes(queueFile);
        Path policy = dir.resolve("policy.json");
        Files.writeString(policy, "{\"blockedTargets\": [\"" + TARGET_X.value() + "\"]}");

        assertEquals(OpBatchCommand.EXIT_OK, execute("--policy", policy.toString()));

        assertEquals(0, bundleCalls.get());
        assertArrayEquals(before, Files.readAllBytes(queueFile));
    }
}
