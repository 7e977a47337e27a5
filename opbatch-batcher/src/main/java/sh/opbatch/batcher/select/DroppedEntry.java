// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.select;

import java.util.List;
import java.util.Objects;

import sh.opbatch.core.model.QueueEntry;

/**
 * A queue entry removed because it violated the policy.
 *
 * @param entry   the removed entry
 * @param reasons the violations found
 */
public record DroppedEntry(QueueEntry entry, List<String> reasons) {

    public DroppedEntry {
        Objects.requireNonNull(entry, "entry");
        reasons = List.copyOf(reasons);
    }
}
