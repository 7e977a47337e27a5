// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.error;

import java.nio.file.Path;

/**
 * Thrown when a durable store file cannot be read, parsed or replaced.
 */
public final class QueueStoreException extends OpBatchException {

    private final Path file;

    public QueueStoreException(final Path file, final String message, final Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
