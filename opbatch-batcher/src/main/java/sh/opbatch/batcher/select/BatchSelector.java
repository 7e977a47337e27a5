// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.select;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToLongFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.opbatch.batcher.policy.Policy;
import sh.opbatch.batcher.policy.PolicyValidator;
import sh.opbatch.core.model.QueueEntry;
import sh.opbatch.core.types.Address;

/**
 * Splits the loaded queue into operations to send now, operations to keep and
 * operations to drop.
 *
 * <p>
 * Entries are grouped by target. Each target may send at most
 * {@code maxPerTargetPerWindow - alreadySent(target)} entries, taken oldest first;
 * the rest of the group is retained. Candidates for a blocked target are retained,
 * candidates that fail {@link PolicyValidator} are dropped. All three lists keep
 * queue order.
 */
public final class BatchSelector {

    private static final Logger log = LoggerFactory.getLogger(BatchSelector.class);

    private enum Fate { SEND, RETAIN, DROP }

    private BatchSelector() {
    }

    /**
     * @param queue                 entries in queue order
     * @param policy                admission limits
     * @param alreadySent           operations sent per target in the open window
     * @param maxPerTargetPerWindow per-target cap per window
     * @return the partition of {@code queue}
     */
    public static Selection select(
            final List<QueueEntry> queue,
            final Policy policy,
            final ToLongFunction<Address> alreadySent,
            final int maxPerTargetPerWindow) {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(alreadySent, "alreadySent");
        if (maxPerTargetPerWindow < 0) {
            throw new IllegalArgumentException("maxPerTargetPerWindow must be >= 0, got: " + maxPerTargetPerWindow);
        }

        final Map<Address, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < queue.size(); i++) {
            groups.computeIfAbsent(queue.get(i).target(), t -> new ArrayList<>()).add(i);
        }

        final Fate[] fates = new Fate[queue.size()];
        final Map<Integer, List<String>> reasons = new LinkedHashMap<>();
        for (Map.Entry<Address, List<Integer>> group : groups.entrySet()) {
            final Address target = group.getKey();
            final List<Integer> indices = group.getValue();
            final long allowed = Math.max(0L, maxPerTargetPerWindow - alreadySent.applyAsLong(target));
            if (allowed < indices.size()) {
                log.info("Target {} over its window cap, holding {} of {} entries",
                        target, indices.size() - allowed, indices.size());
            }
            for (int n = 0; n < indices.size(); n++) {
                final int index = indices.get(n);
                final QueueEntry entry = queue.get(index);
                if (n >= allowed) {
                    fates[index] = Fate.RETAIN;
                } else if (policy.isBlocked(target)) {
                    log.warn("Skip blocked target {} (session {})", target, entry.session());
                    fates[index] = Fate.RETAIN;
                } else {
                    final List<String> errors = PolicyValidator.validate(entry.op(), policy);
                    if (errors.isEmpty()) {
                        fates[index] = Fate.SEND;
                    } else {
                        log.warn("Validation failed for session={}: {}", entry.session(), String.join("; ", errors));
                        fates[index] = Fate.DROP;
                        reasons.put(index, errors);
                    }
                }
            }
        }

        final List<QueueEntry> toSend = new ArrayList<>();
        final List<QueueEntry> retained = new ArrayList<>();
        final List<DroppedEntry> dropped = new ArrayList<>();
        for (int i = 0; i < queue.size(); i++) {
            switch (fates[i]) {
                case SEND -> toSend.add(queue.get(i));
                case RETAIN -> retained.add(queue.get(i));
                case DROP -> dropped.add(new DroppedEntry(queue.get(i), reasons.get(i)));
            }
        }
        return new Selection(toSend, retained, dropped);
    }
}
