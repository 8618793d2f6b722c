package dev.metricfortune.service.tracking;

import dev.metricfortune.entity.TrackingEvent;
import dev.metricfortune.metrics.PipelineMetrics;
import dev.metricfortune.repository.TrackingEventRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory coalescing buffer in front of the tracking event table.
 *
 * <p>A flush runs when the buffer reaches {@code maxSize}, or when the flush timer armed by the
 * first unflushed event fires. Only one flush runs at a time; a request that arrives while one is
 * in flight is a no-op. A failed write puts the exact batch back at the head of the buffer, in its
 * original order, and arms a one-shot retry timer. Events are delayed, never dropped, which makes
 * persistence at-least-once.</p>
 */
@Component
@Slf4j
public class EventBuffer {

    private final TrackingEventRepository repository;
    private final PipelineMetrics metrics;
    private final Scheduler timerScheduler;
    private final int maxSize;
    private final Duration flushInterval;
    private final Duration retryDelay;
    private final Duration closeTimeout;

    // guarded by this
    private final Deque<TrackingEvent> pending = new ArrayDeque<>();
    // guarded by this
    private Disposable timer;

    private final AtomicBoolean flushing = new AtomicBoolean(false);
    private volatile boolean closed;

    @Autowired
    public EventBuffer(TrackingEventRepository repository,
                       PipelineMetrics metrics,
                       @Value("${tracking.buffer.max-size:100}") int maxSize,
                       @Value("${tracking.buffer.flush-interval-ms:5000}") long flushIntervalMs,
                       @Value("${tracking.buffer.retry-delay-ms:5000}") long retryDelayMs) {
        this(repository, metrics, Schedulers.parallel(), maxSize,
                Duration.ofMillis(flushIntervalMs), Duration.ofMillis(retryDelayMs));
    }

    public EventBuffer(TrackingEventRepository repository,
                       PipelineMetrics metrics,
                       Scheduler timerScheduler,
                       int maxSize,
                       Duration flushInterval,
                       Duration retryDelay) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("tracking.buffer.max-size must be positive");
        }
        this.repository = repository;
        this.metrics = metrics;
        this.timerScheduler = timerScheduler;
        this.maxSize = maxSize;
        this.flushInterval = flushInterval;
        this.retryDelay = retryDelay;
        this.closeTimeout = flushInterval.plusSeconds(10);
    }

    @PostConstruct
    public void registerMetrics() {
        metrics.bindBufferSize(this::size);
        log.info("Event buffer ready: max size {}, flush interval {}ms, retry delay {}ms",
                maxSize, flushInterval.toMillis(), retryDelay.toMillis());
    }

    public void add(TrackingEvent event) {
        addBatch(List.of(event));
    }

    public void addBatch(List<TrackingEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        if (closed) {
            throw new IllegalStateException("Event buffer is closed");
        }
        boolean full;
        synchronized (this) {
            pending.addAll(events);
            full = pending.size() >= maxSize;
            if (!full) {
                armTimer(flushInterval);
            }
        }
        if (full) {
            log.debug("Event buffer reached {} events, flushing", maxSize);
            triggerFlush();
        }
    }

    /**
     * Drains the buffer into one bulk insert. Completes empty when the buffer is empty or
     * another flush is in flight; never errors, failed batches are re-queued.
     */
    public Mono<Void> flush() {
        return Mono.defer(() -> {
            if (!flushing.compareAndSet(false, true)) {
                log.debug("Flush already in progress, skipping");
                return Mono.empty();
            }
            List<TrackingEvent> batch;
            synchronized (this) {
                cancelTimer();
                batch = new ArrayList<>(pending);
                pending.clear();
            }
            if (batch.isEmpty()) {
                flushing.set(false);
                return Mono.empty();
            }
            return repository.insertAllSkipDuplicates(batch)
                    .doOnNext(inserted -> {
                        metrics.recordPersisted(batch.size());
                        log.debug("Flushed {} events ({} new rows)", batch.size(), inserted);
                    })
                    .then()
                    .onErrorResume(e -> {
                        requeue(batch, e);
                        return Mono.empty();
                    })
                    .doFinally(signal -> {
                        flushing.set(false);
                        synchronized (this) {
                            if (!pending.isEmpty() && !closed) {
                                armTimer(flushInterval);
                            }
                        }
                    });
        });
    }

    public synchronized int size() {
        return pending.size();
    }

    /** Discards buffered events without writing them. */
    public synchronized void clear() {
        cancelTimer();
        pending.clear();
    }

    /**
     * Stops the timers and writes whatever is left. Called on shutdown.
     */
    @PreDestroy
    public void close() {
        closed = true;
        synchronized (this) {
            cancelTimer();
        }
        int remaining = size();
        if (remaining > 0) {
            log.info("Flushing {} buffered events before shutdown", remaining);
            flush().block(closeTimeout);
        }
        if (size() > 0) {
            log.error("{} tracking events could not be persisted before shutdown", size());
        }
    }

    private void requeue(List<TrackingEvent> batch, Throwable cause) {
        log.error("Failed to flush {} events, re-queueing for retry in {}ms: {}",
                batch.size(), retryDelay.toMillis(), cause.getMessage());
        metrics.recordFlushFailure();
        synchronized (this) {
            // walk backwards so the batch keeps its order ahead of anything added meanwhile
            ListIterator<TrackingEvent> it = batch.listIterator(batch.size());
            while (it.hasPrevious()) {
                pending.addFirst(it.previous());
            }
            if (!closed) {
                cancelTimer();
                armTimer(retryDelay);
            }
        }
    }

    private void triggerFlush() {
        flush().subscribe(
                null,
                error -> log.error("Unexpected error flushing event buffer", error)
        );
    }

    // caller holds the lock
    private void armTimer(Duration delay) {
        if (timer == null || timer.isDisposed()) {
            timer = timerScheduler.schedule(this::onTimer, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void onTimer() {
        synchronized (this) {
            timer = null;
        }
        triggerFlush();
    }

    // caller holds the lock
    private void cancelTimer() {
        if (timer != null) {
            timer.dispose();
            timer = null;
        }
    }
}
