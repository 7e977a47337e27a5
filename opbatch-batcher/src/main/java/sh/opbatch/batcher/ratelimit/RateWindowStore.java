// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.ratelimit;

import java.util.Map;

import sh.opbatch.core.types.Address;

/**
 * Durable per-target {@link RateWindow}s.
 */
public interface RateWindowStore {

    Map<Address, RateWindow> load();

    void save(Map<Address, RateWindow> windows);
}
