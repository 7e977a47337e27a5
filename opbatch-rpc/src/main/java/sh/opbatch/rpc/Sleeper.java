// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

/**
 * Blocks the calling thread between retry attempts.
 *
 * <p>
 * {@link #SYSTEM} delegates to {@link Thread#sleep(long)}; tests substitute a recorder.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
