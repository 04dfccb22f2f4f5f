// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.worker;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainweave.core.LogSanitizer;
import io.chainweave.core.error.InvalidTransitionException;
import io.chainweave.core.types.RequestId;
import io.chainweave.hub.MintRequest;
import io.chainweave.hub.RequestRegistry;
import io.chainweave.hub.RequestStatus;

/**
 * Drives pending hub requests through the generation pipeline.
 *
 * <p>Each poll first fails requests left in PROCESSING for longer than the
 * configured processing timeout, typically by a worker that stopped
 * mid-generation, so their requesters can retry or cancel. It then
 * re-dispatches generated requests whose earlier dispatch failed, and takes up to {@code batchSize} PENDING requests and, for each,
 * marks it PROCESSING, runs the pipeline, records the result and dispatches
 * the mint instruction. A pipeline failure is reported with
 * {@code failGeneration}; the requester decides whether to retry. A failure on
 * one request never stops the rest of the batch.
 *
 * <p>Use {@link #pollOnce()} to drive the worker by hand, or {@link #start()}
 * to poll on a background thread until {@link #close()}. Polls must not
 * overlap: a request this worker is generating would otherwise look abandoned.
 */
public final class GenerationWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GenerationWorker.class);

    private static final int MAX_REASON_LOG_LENGTH = 200;

    static final String TIMEOUT_REASON = "generation timed out";

    private final WorkerConfig config;
    private final RequestRegistry registry;
    private final GenerationPipeline pipeline;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "chainweave-worker");
        t.setDaemon(true);
        return t;
    });
    private volatile @Nullable ScheduledFuture<?> pollTask;

    public GenerationWorker(
            final WorkerConfig config, final RequestRegistry registry, final GenerationPipeline pipeline) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    // ==================== Polling ====================

    /**
     * Runs one poll.
     *
     * @return number of requests dispatched during this poll
     */
    public int pollOnce() {
        failAbandoned();
        int dispatched = 0;
        for (final MintRequest request : registry.requestsByStatus(
                RequestStatus.AI_COMPLETED, 0, config.batchSize()).items()) {
            if (dispatch(request.requestId())) {
                dispatched++;
            }
        }
        for (final MintRequest request : registry.requestsByStatus(
                RequestStatus.PENDING, 0, config.batchSize()).items()) {
            try {
                if (process(request)) {
                    dispatched++;
                }
            } catch (RuntimeException e) {
                log.error("Worker failed on request {}", request.requestId().shortForm(), e);
            }
        }
        return dispatched;
    }

    private void failAbandoned() {
        for (final MintRequest request : registry.staleProcessing(config.processingTimeout())) {
            final RequestId id = request.requestId();
            try {
                registry.failGeneration(config.worker(), id, TIMEOUT_REASON);
                log.warn("Request {} stuck in PROCESSING since {}, marked failed", id.shortForm(), request.updatedAt());
            } catch (InvalidTransitionException e) {
                log.info("Request {} moved on before it could be failed: {}", id.shortForm(), e.getMessage());
            }
        }
    }

    private boolean process(final MintRequest request) {
        final RequestId id = request.requestId();
        try {
            registry.markProcessing(config.worker(), id);
        } catch (InvalidTransitionException e) {
            log.info("Skipping request {}: {}", id.shortForm(), e.getMessage());
            return false;
        }

        final GeneratedArtwork artwork;
        try {
            artwork = pipeline.generate(request.prompt());
        } catch (RuntimeException e) {
            final String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("Generation failed for request {}: {}",
                    id.shortForm(), LogSanitizer.abbreviate(reason, MAX_REASON_LOG_LENGTH));
            registry.failGeneration(config.worker(), id, reason);
            return false;
        }

        try {
            registry.completeGeneration(config.worker(), id, artwork.tokenUri());
        } catch (InvalidTransitionException e) {
            // cancelled by the requester while the pipeline ran
            log.info("Discarding artwork for request {}: {}", id.shortForm(), e.getMessage());
            return false;
        }
        log.debug("Generated {} for request {}", artwork.tokenUri(), id.shortForm());
        return dispatch(id);
    }

    private boolean dispatch(final RequestId id) {
        try {
            registry.dispatchCrossChain(config.worker(), id);
            return true;
        } catch (RuntimeException e) {
            log.error("Dispatch failed for request {}, will retry on next poll", id.shortForm(), e);
            return false;
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Starts polling on a background thread, first poll immediately.
     *
     * @throws IllegalStateException if already started or closed
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Worker is closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker already started");
        }
        final long intervalMillis = config.pollInterval().toMillis();
        pollTask = scheduler.scheduleWithFixedDelay(this::pollSafely, 0, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Worker {} polling every {} ms (batch size {})", config.worker(), intervalMillis, config.batchSize());
    }

    private void pollSafely() {
        try {
            final int dispatched = pollOnce();
            if (dispatched > 0) {
                log.debug("Poll dispatched {} requests", dispatched);
            }
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the scheduled task
            log.error("Worker poll failed", e);
        }
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    /**
     * Stops polling and waits briefly for an in-flight poll to finish.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            final ScheduledFuture<?> task = pollTask;
            if (task != null) {
                task.cancel(false);
            }
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Worker poll still running after 5 s, abandoning it");
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
            log.info("Worker {} stopped", config.worker());
        }
    }
}
