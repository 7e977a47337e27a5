// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.ratelimit;

import java.time.Duration;

/**
 * Operations sent to one target in the current fixed window.
 *
 * @param windowStart unix seconds at which the window opened
 * @param count       operations sent since {@code windowStart}
 */
public record RateWindow(long windowStart, long count) {

    public RateWindow {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + count);
        }
    }

    /**
     * Returns {@code true} once {@code now - windowStart >= length}.
     */
    public boolean isExpired(final long now, final Duration length) {
        return now - windowStart >= length.getSeconds();
    }

    /**
     * @return {@link #count()} while the window is open, otherwise 0
     */
    public long sentAt(final long now, final Duration length) {
        return isExpired(now, length) ? 0 : count;
    }

    /**
     * Adds {@code sent} operations, opening a new window at {@code now} if this one expired.
     */
    public RateWindow add(final long now, final long sent, final Duration length) {
        if (isExpired(now, length)) {
            return new RateWindow(now, sent);
        }
        return new RateWindow(windowStart, count + sent);
    }
}
