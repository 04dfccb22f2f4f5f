// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.worker;

import java.time.Duration;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.chainweave.core.types.Address;

/**
 * Settings for a {@link GenerationWorker}.
 *
 * @param worker       address the worker acts as; must be the hub's trusted worker
 * @param batchSize    maximum requests picked up per poll
 * @param pollInterval delay between the end of one poll and the start of the next
 * @param processingTimeout how long a request may sit in PROCESSING before the worker fails it
 */
public record WorkerConfig(Address worker, int batchSize, Duration pollInterval, Duration processingTimeout) {

    public static final int DEFAULT_BATCH_SIZE = 5;

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    public static final Duration DEFAULT_PROCESSING_TIMEOUT = Duration.ofMinutes(15);

    public WorkerConfig {
        Objects.requireNonNull(worker, "worker");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(processingTimeout, "processingTimeout");
        if (worker.isZero()) {
            throw new IllegalArgumentException("worker must be non-zero");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + batchSize);
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
        if (processingTimeout.isZero() || processingTimeout.isNegative()) {
            throw new IllegalArgumentException("processingTimeout must be positive, got: " + processingTimeout);
        }
    }

    public static WorkerConfig defaults(final Address worker) {
        return new WorkerConfig(worker, DEFAULT_BATCH_SIZE, DEFAULT_POLL_INTERVAL, DEFAULT_PROCESSING_TIMEOUT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nullable Address worker;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration processingTimeout = DEFAULT_PROCESSING_TIMEOUT;

        private Builder() {}

        public Builder worker(Address worker) {
            this.worker = worker;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder processingTimeout(Duration processingTimeout) {
            this.processingTimeout = processingTimeout;
            return this;
        }

        public WorkerConfig build() {
            return new WorkerConfig(worker, batchSize, pollInterval, processingTimeout);
        }
    }
}
