// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.queue;

import static org.junit.jupiter.api.Assertions.*;
import static sh.opbatch.batcher.Fixtures.TARGET_X;
import static sh.opbatch.batcher.Fixtures.TARGET_Y;
import static sh.opbatch.batcher.Fixtures.entry;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import sh.opbatch.core.error.QueueStoreException;
import sh.opbatch.core.model.QueueEntry;
import sh.opbatch.core.types.Wei;

class JsonFileQueueStoreTest {

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsEmpty() {
        assertEquals(List.of(), new JsonFileQueueStore(dir.resolve("queue.json")).load());
    }

    @Test
    void nonArrayRootLoadsEmpty() throws IOException {
        Path file = dir.resolve("queue.json");
        Files.writeString(file, "{\"op\": {}}");

        assertEquals(List.of(), new JsonFileQueueStore(file).load());
    }

    @Test
    void savedQueueReadsBackInOrder() {
        JsonFileQueueStore store = new JsonFileQueueStore(dir.resolve("queue.json"));
        List<QueueEntry> entries = List.of(entry(2, TARGET_X), entry(1, TARGET_Y), entry(3, TARGET_X));

        store.save(entries);

        assertEquals(entries, store.load());
    }

    @Test
    void saveCreatesMissingDirectoriesAndLeavesNoTempFiles() throws IOException {
        Path file = dir.resolve("nested/queue.json");
        new JsonFileQueueStore(file).save(List.of(entry(1, TARGET_X)));

        try (var files = Files.list(file.getParent())) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void readsHandWrittenQueueWithDecimalAndHexQuantities() throws IOException {
        Path file = dir.resolve("queue.json");
        Files.writeString(file, """
                [
                  {
                    "op": {
                      "sender": "0xAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA",
                      "nonce": "0x0",
                      "initCode": "0x",
                      "callData": "0xb61d27f6",
                      "callGasLimit": "100000",
                      "verificationGasLimit": 150000,
                      "preVerificationGas": "0x5208",
                      "maxFeePerGas": "0x0",
                      "maxPriorityFeePerGas": "0x0",
                      "paymasterAndData": "0x",
                      "signature": "0x1234"
                    },
                    "target": "0x1111111111111111111111111111111111111111",
                    "session": "alice",
                    "createdAt": 1700000000
                  }
                ]
                """);

        List<QueueEntry> entries = new JsonFileQueueStore(file).load();

        assertEquals(1, entries.size());
        QueueEntry only = entries.get(0);
        assertEquals(TARGET_X, only.target());
        assertEquals("alice", only.session());
        assertEquals(1_700_000_000L, only.createdAt());
        assertEquals(BigInteger.valueOf(100_000), only.op().callGasLimit());
        assertEquals(BigInteger.valueOf(150_000), only.op().verificationGasLimit());
        assertEquals(BigInteger.valueOf(21_000), only.op().preVerificationGas());
        assertEquals(Wei.ZERO, only.op().maxFeePerGas());
        assertTrue(only.op().hasUnsetFees());
    }

    @Test
    void malformedEntryFailsLoad() throws IOException {
        Path file = dir.resolve("queue.json");
        Files.writeString(file, "[{\"op\": {\"sender\": \"0x01\"}, \"target\": \"0x1111111111111111111111111111111111111111\"}]");

        QueueStoreException ex = assertThrows(QueueStoreException.class, () -> new JsonFileQueueStore(file).load());
        assertEquals(file, ex.file());
        assertTrue(ex.getMessage().contains("index 0"));
    }

    @Test
    void invalidJsonFailsLoad() throws IOException {
        Path file = dir.resolve("queue.json");
        Files.writeString(file, "[{");

        assertThrows(QueueStoreException.class, () -> new JsonFileQueueStore(file).load());
    }
}
