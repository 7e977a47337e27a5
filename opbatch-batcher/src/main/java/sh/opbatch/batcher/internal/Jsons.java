// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Shared JSON mapper and atomic file replacement for the on-disk stores.
 */
public final class Jsons {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes {@code value} to a temporary file next to {@code file} and moves it over
     * {@code file}. Readers see either the old or the new content, never a partial write.
     *
     * @param file  destination
     * @param value JSON-serializable value
     * @throws IOException if the temporary file cannot be written or moved
     */
    public static void writeAtomically(final Path file, final Object value) throws IOException {
        final Path absolute = file.toAbsolutePath();
        final Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        final Path tmp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, MAPPER.writeValueAsBytes(value));
            try {
                Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
