// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

import sh.opbatch.batcher.ratelimit.JsonFileRateWindowStore;
import sh.opbatch.core.types.Address;
import sh.opbatch.rpc.RpcRetryConfig;

/**
 * Settings for one batch run.
 *
 * @param bundlerUrl            relay JSON-RPC endpoint
 * @param entryPoint            EntryPoint contract the bundle targets
 * @param queueFile             queue store location
 * @param rateStateFile         rate window sidecar location
 * @param maxPerTargetPerWindow per-target send cap per window
 * @param window                rate window length
 * @param dryRun                stop after fee backfill without sending
 * @param retry                 submission retry settings
 */
public record BatcherConfig(
        String bundlerUrl,
        Address entryPoint,
        Path queueFile,
        Path rateStateFile,
        int maxPerTargetPerWindow,
        Duration window,
        boolean dryRun,
        RpcRetryConfig retry) {

    public static final String DEFAULT_BUNDLER_URL = "http://127.0.0.1:3000";
    public static final Address DEFAULT_ENTRY_POINT = new Address("0x0576a174D229E3cFA37253523E645A78A0C91B57");
    public static final Path DEFAULT_QUEUE_FILE = Path.of("queue.json");
    public static final int DEFAULT_MAX_PER_TARGET = 20;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    public BatcherConfig {
        Objects.requireNonNull(bundlerUrl, "bundlerUrl");
        Objects.requireNonNull(entryPoint, "entryPoint");
        Objects.requireNonNull(queueFile, "queueFile");
        Objects.requireNonNull(rateStateFile, "rateStateFile");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(retry, "retry");
        final String scheme = URI.create(bundlerUrl).getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("bundlerUrl must be an http(s) URL, got: " + bundlerUrl);
        }
        if (maxPerTargetPerWindow < 0) {
            throw new IllegalArgumentException("maxPerTargetPerWindow must be >= 0, got: " + maxPerTargetPerWindow);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String bundlerUrl = DEFAULT_BUNDLER_URL;
        private Address entryPoint = DEFAULT_ENTRY_POINT;
        private Path queueFile = DEFAULT_QUEUE_FILE;
        private Path rateStateFile;
        private int maxPerTargetPerWindow = DEFAULT_MAX_PER_TARGET;
        private Duration window = DEFAULT_WINDOW;
        private boolean dryRun;
        private RpcRetryConfig retry = RpcRetryConfig.defaults();

        private Builder() {}

        public Builder bundlerUrl(String bundlerUrl) {
            this.bundlerUrl = bundlerUrl;
            return this;
        }

        public Builder entryPoint(Address entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder queueFile(Path queueFile) {
            this.queueFile = queueFile;
            return this;
        }

        /** Defaults to {@code <queueFile>.ratelimit.json}. */
        public Builder rateStateFile(Path rateStateFile) {
            this.rateStateFile = rateStateFile;
            return this;
        }

        public Builder maxPerTargetPerWindow(int maxPerTargetPerWindow) {
            this.maxPerTargetPerWindow = maxPerTargetPerWindow;
            return this;
        }

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder retry(RpcRetryConfig retry) {
            this.retry = retry;
            return this;
        }

        public BatcherConfig build() {
            final Path sidecar = rateStateFile != null
                    ? rateStateFile
                    : JsonFileRateWindowStore.sidecarFor(Objects.requireNonNull(queueFile, "queueFile"));
            return new BatcherConfig(
                    bundlerUrl, entryPoint, queueFile, sidecar, maxPerTargetPerWindow, window, dryRun, retry);
        }
    }
}
