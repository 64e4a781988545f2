package com.herzen.activity.client;

import com.herzen.activity.telemetry.ActivityModels.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Session-scoped telemetry buffer. Recording never throws and never blocks on I/O:
 * events are queued and sent in batches, either when {@code maxSize} events are queued
 * or {@code flushDelay} after the first event of a batch.
 * <p>
 * Delivery is best effort. A failed batch is logged and dropped, and events recorded
 * without a session token are discarded. Clearing the token abandons unsent events.
 * <p>
 * The queue is swapped for an empty one under the instance lock before a batch is handed
 * to the transmit executor, so events recorded during a transmission start a new batch.
 */
@Slf4j
public class TelemetryBuffer implements AutoCloseable {
    private final TelemetryTransport transport;
    private final TaskScheduler scheduler;
    private final Executor transmitExecutor;
    private final Clock clock;
    private final int maxSize;
    private final Duration flushDelay;

    private String sessionToken;
    private List<TelemetryEvent> queue = new ArrayList<>();
    private ScheduledFuture<?> pendingFlush;
    private long timerGeneration;

    public TelemetryBuffer(TelemetryTransport transport,
                           TaskScheduler scheduler,
                           Executor transmitExecutor,
                           Clock clock,
                           int maxSize,
                           Duration flushDelay) {
        this.transport = transport;
        this.scheduler = scheduler;
        this.transmitExecutor = transmitExecutor;
        this.clock = clock;
        this.maxSize = maxSize;
        this.flushDelay = flushDelay;
    }

    public void record(TelemetryEvent event) {
        Batch batch;
        synchronized (this) {
            if (sessionToken == null || event == null) return;
            queue.add(event);
            if (queue.size() < maxSize) {
                scheduleFlush();
                return;
            }
            batch = drain();
        }
        transmit(batch);
    }

    /**
     * Replaces the credential used for transmission. {@code null} or blank ends the session:
     * the queue is cleared and the pending flush cancelled.
     */
    public void setSessionToken(String token) {
        synchronized (this) {
            sessionToken = (token == null || token.isBlank()) ? null : token;
            if (sessionToken == null) {
                queue = new ArrayList<>();
                cancelPendingFlush();
            }
        }
    }

    public void flush() {
        Batch batch;
        synchronized (this) {
            batch = drain();
        }
        transmit(batch);
    }

    public synchronized int pendingEvents() {
        return queue.size();
    }

    public synchronized boolean flushScheduled() {
        return pendingFlush != null;
    }

    @Override
    public void close() {
        setSessionToken(null);
    }

    private void scheduleFlush() {
        if (pendingFlush != null) return;
        long generation = ++timerGeneration;
        try {
            pendingFlush = scheduler.schedule(() -> onTimer(generation), clock.instant().plus(flushDelay));
        } catch (RuntimeException e) {
            log.warn("Telemetry flush timer not scheduled, {} events wait for the next trigger: {}", queue.size(), e.getMessage());
        }
    }

    private void onTimer(long generation) {
        Batch batch;
        synchronized (this) {
            // a cancelled or superseded timer that already started running
            if (pendingFlush == null || generation != timerGeneration) return;
            pendingFlush = null;
            batch = drain();
        }
        transmit(batch);
    }

    // caller holds the lock
    private Batch drain() {
        cancelPendingFlush();
        if (sessionToken == null || queue.isEmpty()) return null;
        List<TelemetryEvent> events = queue;
        queue = new ArrayList<>();
        return new Batch(sessionToken, events);
    }

    private void cancelPendingFlush() {
        if (pendingFlush != null) {
            pendingFlush.cancel(false);
            pendingFlush = null;
        }
    }

    private void transmit(Batch batch) {
        if (batch == null) return;
        try {
            transmitExecutor.execute(() -> send(batch));
        } catch (RuntimeException e) {
            log.warn("Dropped {} telemetry events, transmitter unavailable: {}", batch.events().size(), e.getMessage());
        }
    }

    private void send(Batch batch) {
        Instant sentAt = clock.instant();
        List<TelemetryEvent> events = batch.events().stream()
                .map(e -> e.occurredAt() == null ? e.withOccurredAt(sentAt) : e)
                .toList();
        try {
            transport.send(batch.token(), events);
        } catch (RuntimeException e) {
            log.warn("Failed to send {} telemetry events: {}", events.size(), e.getMessage());
        }
    }

    private record Batch(String token, List<TelemetryEvent> events) {}
}
