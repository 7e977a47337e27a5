// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.opbatch.core.types.Address;

/**
 * Fixed-window counter of operations sent per target.
 *
 * <p>
 * Reads are served from the windows loaded at construction. {@link #recordSent(Map)}
 * re-reads the store, advances the affected windows and writes them back.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateWindowStore store;
    private final Duration window;
    private final Clock clock;
    private final Map<Address, RateWindow> loaded;

    public RateLimiter(final RateWindowStore store, final Duration window, final Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.window = Objects.requireNonNull(window, "window");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        this.loaded = store.load();
    }

    /**
     * @return operations already sent to {@code target} in its open window
     */
    public long alreadySent(final Address target) {
        final RateWindow current = loaded.get(target);
        return current == null ? 0 : current.sentAt(now(), window);
    }

    /**
     * Adds the given per-target counts to the durable windows.
     *
     * @param sentPerTarget operations just sent, keyed by target
     */
    public void recordSent(final Map<Address, Integer> sentPerTarget) {
        if (sentPerTarget.isEmpty()) {
            return;
        }
        final long now = now();
        final Map<Address, RateWindow> windows = new LinkedHashMap<>();
        for (Map.Entry<Address, RateWindow> entry : store.load().entrySet()) {
            if (!entry.getValue().isExpired(now, window)) {
                windows.put(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<Address, Integer> sent : sentPerTarget.entrySet()) {
            final RateWindow previous = windows.getOrDefault(sent.getKey(), new RateWindow(now, 0));
            final RateWindow next = previous.add(now, sent.getValue(), window);
            windows.put(sent.getKey(), next);
            log.debug("Rate window for {}: {} sent since {}", sent.getKey(), next.count(), next.windowStart());
        }
        store.save(windows);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
