// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.select;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import sh.opbatch.core.model.QueueEntry;
import sh.opbatch.core.model.UserOperation;
import sh.opbatch.core.types.Address;

/**
 * Outcome of {@link BatchSelector#select}: every loaded entry is in exactly one list.
 *
 * @param toSend   entries admitted for this bundle
 * @param retained entries kept in the queue for a later run
 * @param dropped  entries removed for policy violations
 */
public record Selection(List<QueueEntry> toSend, List<QueueEntry> retained, List<DroppedEntry> dropped) {

    public Selection {
        toSend = List.copyOf(toSend);
        retained = List.copyOf(retained);
        dropped = List.copyOf(dropped);
    }

    public boolean hasDropped() {
        return !dropped.isEmpty();
    }

    /**
     * @return the operations of {@link #toSend()}, in order
     */
    public List<UserOperation> operations() {
        final List<UserOperation> ops = new ArrayList<>(toSend.size());
        for (QueueEntry entry : toSend) {
            ops.add(entry.op());
        }
        return ops;
    }

    /**
     * @return number of {@link #toSend()} entries per target
     */
    public Map<Address, Integer> sentPerTarget() {
        final Map<Address, Integer> counts = new LinkedHashMap<>();
        for (QueueEntry entry : toSend) {
            counts.merge(entry.target(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Computes the queue to persist after this selection has been acted on.
     *
     * <p>
     * {@code current} is the store as it reads now. Entries in it that were not part of
     * this selection arrived while the run was in progress and are appended after
     * {@link #retained()}. Matching is by value and counts duplicates.
     *
     * @param current the store's current contents
     * @return retained entries followed by new arrivals
     */
    public List<QueueEntry> remainingWith(final List<QueueEntry> current) {
        final Map<QueueEntry, Integer> seen = new HashMap<>();
        for (QueueEntry entry : toSend) {
            seen.merge(entry, 1, Integer::sum);
        }
        for (QueueEntry entry : retained) {
            seen.merge(entry, 1, Integer::sum);
        }
        for (DroppedEntry entry : dropped) {
            seen.merge(entry.entry(), 1, Integer::sum);
        }

        final List<QueueEntry> remaining = new ArrayList<>(retained);
        for (QueueEntry entry : current) {
            final int count = seen.getOrDefault(entry, 0);
            if (count > 0) {
                seen.put(entry, count - 1);
            } else {
                remaining.add(entry);
            }
        }
        return remaining;
    }
}
