// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.queue;

import java.util.List;

import sh.opbatch.core.error.QueueStoreException;
import sh.opbatch.core.model.QueueEntry;

/**
 * Durable, ordered list of pending operations.
 *
 * <p>
 * A run loads the whole queue once and replaces it at most once. Implementations
 * assume a single writer per store.
 */
public interface QueueStore {

    /**
     * Reads every stored entry in insertion order.
     *
     * @return the entries; empty if nothing has been stored yet
     * @throws QueueStoreException if the store exists but cannot be read or parsed
     */
    List<QueueEntry> load();

    /**
     * Replaces the stored queue with {@code entries}.
     *
     * @param entries the complete new queue, in order
     * @throws QueueStoreException if the store cannot be written
     */
    void save(List<QueueEntry> entries);
}
