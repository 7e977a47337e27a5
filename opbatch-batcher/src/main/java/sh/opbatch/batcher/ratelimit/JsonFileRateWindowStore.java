// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.ratelimit;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.opbatch.batcher.internal.Jsons;
import sh.opbatch.core.error.QueueStoreException;
import sh.opbatch.core.types.Address;

/**
 * {@link RateWindowStore} kept in a JSON sidecar file:
 * {@code {"0xtarget": {"windowStart": 1700000000, "count": 3}}}.
 */
public final class JsonFileRateWindowStore implements RateWindowStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRateWindowStore.class);

    static final String WINDOW_START = "windowStart";
    static final String COUNT = "count";

    private final Path file;

    public JsonFileRateWindowStore(final Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    /**
     * Default sidecar location for a queue file: {@code <queue>.ratelimit.json}.
     */
    public static Path sidecarFor(final Path queueFile) {
        return queueFile.resolveSibling(queueFile.getFileName().toString() + ".ratelimit.json");
    }

    @Override
    public Map<Address, RateWindow> load() {
        if (!Files.exists(file)) {
            return Map.of();
        }
        final JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new QueueStoreException(file, "Unable to read rate windows", e);
        }
        if (root == null || !root.isObject()) {
            log.warn("Rate window file {} does not hold a JSON object, treating as empty", file);
            return Map.of();
        }
        final Map<Address, RateWindow> windows = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            try {
                windows.put(new Address(field.getKey()), parse(field.getValue()));
            } catch (IllegalArgumentException e) {
                throw new QueueStoreException(file, "Malformed rate window for " + field.getKey(), e);
            }
        }
        return windows;
    }

    @Override
    public void save(final Map<Address, RateWindow> windows) {
        final Map<String, Map<String, Long>> out = new LinkedHashMap<>();
        for (Map.Entry<Address, RateWindow> entry : windows.entrySet()) {
            final Map<String, Long> window = new LinkedHashMap<>();
            window.put(WINDOW_START, entry.getValue().windowStart());
            window.put(COUNT, entry.getValue().count());
            out.put(entry.getKey().value(), window);
        }
        try {
            Jsons.writeAtomically(file, out);
        } catch (IOException e) {
            throw new QueueStoreException(file, "Unable to write rate windows", e);
        }
    }

    private static RateWindow parse(final JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("rate window must be an object");
        }
        final JsonNode start = node.get(WINDOW_START);
        final JsonNode count = node.get(COUNT);
        if (start == null || !start.canConvertToLong() || count == null || !count.canConvertToLong()) {
            throw new IllegalArgumentException("rate window needs integer '" + WINDOW_START + "' and '" + COUNT + "'");
        }
        return new RateWindow(start.asLong(), count.asLong());
    }
}
