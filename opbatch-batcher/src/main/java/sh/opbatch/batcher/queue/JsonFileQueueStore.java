// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.opbatch.batcher.internal.Jsons;
import sh.opbatch.core.error.QueueStoreException;
import sh.opbatch.core.model.QueueEntry;

/**
 * {@link QueueStore} backed by a pretty-printed JSON array on disk.
 *
 * <p>
 * A missing file, or a file whose root is not an array, loads as an empty queue.
 * An array containing a malformed entry fails the load. Saves replace the file atomically.
 */
public final class JsonFileQueueStore implements QueueStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileQueueStore.class);
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {
    };

    private final Path file;

    public JsonFileQueueStore(final Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    @Override
    public List<QueueEntry> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        final JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new QueueStoreException(file, "Unable to read queue", e);
        }
        if (root == null || !root.isArray()) {
            log.warn("Queue file {} does not hold a JSON array, treating as empty", file);
            return List.of();
        }
        final List<QueueEntry> entries = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            try {
                if (!node.isObject()) {
                    throw new IllegalArgumentException("entry is not a JSON object");
                }
                entries.add(QueueEntry.fromJsonObject(Jsons.mapper().convertValue(node, OBJECT)));
            } catch (IllegalArgumentException e) {
                throw new QueueStoreException(file, "Malformed queue entry at index " + index, e);
            }
            index++;
        }
        return List.copyOf(entries);
    }

    @Override
    public void save(final List<QueueEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        final List<Map<String, Object>> out = new ArrayList<>(entries.size());
        for (QueueEntry entry : entries) {
            out.add(entry.toJsonObject());
        }
        try {
            Jsons.writeAtomically(file, out);
        } catch (IOException e) {
            throw new QueueStoreException(file, "Unable to write queue", e);
        }
        log.debug("Saved {} queue entries to {}", entries.size(), file);
    }
}
