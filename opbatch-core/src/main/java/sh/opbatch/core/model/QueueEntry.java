// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import sh.opbatch.core.types.Address;

/**
 * One pending operation in the durable queue.
 *
 * <p>
 * Entries have no identifier of their own; two entries are the same entry when
 * every field is equal. {@code session} is a diagnostic label and may repeat.
 *
 * @param op        the signed operation
 * @param target    the contract the operation calls, used for per-target rate limiting
 * @param session   human-readable session label for logs
 * @param createdAt enqueue time in unix seconds
 * @since 0.1.0
 */
public record QueueEntry(UserOperation op, Address target, String session, long createdAt) {

    static final String OP = "op";
    static final String TARGET = "target";
    static final String SESSION = "session";
    static final String CREATED_AT = "createdAt";

    public QueueEntry {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(target, "target");
        session = session == null ? "" : session;
    }

    /**
     * Renders this entry in its stored JSON shape.
     *
     * @return a mutable, insertion-ordered map
     */
    public Map<String, Object> toJsonObject() {
        final Map<String, Object> out = new LinkedHashMap<>();
        out.put(OP, op.toRpcObject());
        out.put(TARGET, target.value());
        out.put(SESSION, session);
        out.put(CREATED_AT, createdAt);
        return out;
    }

    /**
     * Parses the stored JSON shape.
     *
     * @param source decoded JSON object
     * @return the entry
     * @throws IllegalArgumentException if a field is missing or malformed
     */
    @SuppressWarnings("unchecked")
    public static QueueEntry fromJsonObject(final Map<String, ?> source) {
        Objects.requireNonNull(source, "source");
        final Object op = source.get(OP);
        if (!(op instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Queue entry is missing object field '" + OP + "'");
        }
        final Object target = source.get(TARGET);
        if (!(target instanceof String targetText)) {
            throw new IllegalArgumentException("Queue entry is missing field '" + TARGET + "'");
        }
        final Object session = source.get(SESSION);
        return new QueueEntry(
                UserOperation.fromRpcObject((Map<String, ?>) op),
                new Address(targetText),
                session == null ? "" : session.toString(),
                createdAt(source.get(CREATED_AT)));
    }

    private static long createdAt(final Object raw) {
        if (raw == null) {
            return 0L;
        }
        if (raw instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Queue entry has invalid '" + CREATED_AT + "': " + raw, e);
        }
    }
}
