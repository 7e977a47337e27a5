// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;

class BatcherConfigTest {

    @Test
    void defaults() {
        BatcherConfig config = BatcherConfig.builder().build();

        assertEquals("http://127.0.0.1:3000", config.bundlerUrl());
        assertEquals("0x0576a174d229e3cfa37253523e645a78a0c91b57", config.entryPoint().value());
        assertEquals(Path.of("queue.json"), config.queueFile());
        assertEquals(Path.of("queue.json.ratelimit.json"), config.rateStateFile());
        assertEquals(20, config.maxPerTargetPerWindow());
        assertEquals(Duration.ofSeconds(60), config.window());
        assertFalse(config.dryRun());
        assertEquals(5, config.retry().maxAttempts());
    }

    @Test
    void rateStateFollowsQueueUnlessSet() {
        Path queue = Path.of("data", "ops.json");

        assertEquals(Path.of("data", "ops.json.ratelimit.json"),
                BatcherConfig.builder().queueFile(queue).build().rateStateFile());
        assertEquals(Path.of("rl.json"),
                BatcherConfig.builder().queueFile(queue).rateStateFile(Path.of("rl.json")).build().rateStateFile());
    }

    @Test
    void rejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> BatcherConfig.builder().maxPerTargetPerWindow(-1).build());
        assertThrows(IllegalArgumentException.class, () -> BatcherConfig.builder().window(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> BatcherConfig.builder().bundlerUrl("localhost:3000").build());
        assertThrows(IllegalArgumentException.class, () -> BatcherConfig.builder().bundlerUrl("not a url").build());
    }
}
