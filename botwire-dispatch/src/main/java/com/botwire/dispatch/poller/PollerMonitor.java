package com.botwire.dispatch.poller;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Poll loop health: status, update count, time of the last update, stall detection.
 */
@Slf4j
public class PollerMonitor {

    public enum Status {
        IDLE, POLLING, ACTIVE, ERROR, STOPPED
    }

    private final String botId;
    private final long stallThresholdMs;
    private final LongSupplier clock;
    private final AtomicLong lastUpdateAt;
    private final AtomicLong updateCount = new AtomicLong();
    private final AtomicReference<Status> status = new AtomicReference<>(Status.IDLE);
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public PollerMonitor(String botId) {
        this(botId, 5 * 60_000, System::currentTimeMillis);
    }

    public PollerMonitor(String botId, long stallThresholdMs, LongSupplier clock) {
        this.botId = botId;
        this.stallThresholdMs = stallThresholdMs;
        this.clock = clock;
        this.lastUpdateAt = new AtomicLong(clock.getAsLong());
    }

    public void recordPollingStarted() {
        lastUpdateAt.set(clock.getAsLong());
        status.set(Status.POLLING);
        log.debug("[monitor] Polling started for bot {}", botId);
    }

    public void recordUpdates(int count) {
        if (count <= 0)
            return;
        lastUpdateAt.set(clock.getAsLong());
        updateCount.addAndGet(count);
        status.set(Status.ACTIVE);
    }

    /** A poll succeeded again after errors. */
    public void recordRecovered() {
        if (status.compareAndSet(Status.ERROR, Status.POLLING)) {
            log.info("[monitor] Polling recovered for bot {}", botId);
        }
    }

    public void recordError(Exception error) {
        status.set(Status.ERROR);
        lastError.set(error.getMessage());
        log.warn("[monitor] Polling error for bot {}: {}", botId, error.getMessage());
    }

    public void recordPollingStopped() {
        status.set(Status.STOPPED);
        log.info("[monitor] Polling stopped for bot {}", botId);
    }

    /**
     * Whether a running poller has seen no update for longer than the stall threshold.
     */
    public boolean isStalled() {
        Status s = status.get();
        if (s != Status.POLLING && s != Status.ACTIVE)
            return false;
        return clock.getAsLong() - lastUpdateAt.get() > stallThresholdMs;
    }

    public HealthStatus getHealthStatus() {
        return new HealthStatus(botId, status.get(), Instant.ofEpochMilli(lastUpdateAt.get()),
                updateCount.get(), isStalled(), lastError.get());
    }

    public record HealthStatus(
            String botId,
            Status status,
            Instant lastUpdateAt,
            long updateCount,
            boolean stalled,
            String lastError) {
    }
}
