package com.botwire.dispatch.poller;

import com.botwire.api.binding.UpdateParser;
import com.botwire.api.errors.MalformedUpdateException;
import com.botwire.api.errors.RemoteApiException;
import com.botwire.api.transport.BotTransport;
import com.botwire.api.types.Update;
import com.botwire.common.config.BotConfig;
import com.botwire.common.errors.BotException;
import com.botwire.common.infra.Backoff;
import com.botwire.common.infra.ErrorUtils;
import com.botwire.dispatch.Dispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-polling loop: fetch a batch, hand every update to the {@link Dispatcher} in arrival order,
 * then move the offset past the batch.
 * <p>
 * The offset only advances after the whole batch has been handed off, so a crash between fetch and
 * dispatch redelivers instead of losing updates. Malformed records are logged and skipped; the
 * offset still moves past them. Transport failures either end the loop ({@code nonStop=false}) or
 * are retried forever with exponential backoff, honouring the server's {@code retry_after}.
 */
@Slf4j
public class UpdatePoller implements AutoCloseable {

    private final BotTransport transport;
    private final UpdateParser parser;
    private final Dispatcher dispatcher;
    private final BotConfig.PollingConfig config;
    private final Backoff.Policy backoff;
    private final UpdateOffsetStore offsetStore;
    private final PollerMonitor monitor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile long offset;
    private volatile Thread pollThread;
    private volatile BotException failure;

    public UpdatePoller(BotTransport transport, UpdateParser parser, Dispatcher dispatcher,
            BotConfig.PollingConfig config) {
        this(transport, parser, dispatcher, config, null, null);
    }

    public UpdatePoller(BotTransport transport, UpdateParser parser, Dispatcher dispatcher,
            BotConfig.PollingConfig config, UpdateOffsetStore offsetStore, PollerMonitor monitor) {
        this(transport, parser, dispatcher, config, offsetStore, monitor, 0);
    }

    /**
     * @param offsetStore   where the last update id is persisted; null keeps the offset in memory only
     * @param monitor       health tracker; null for none
     * @param initialOffset first update id to request, e.g. the offset of a previous poller; a higher
     *                      persisted offset wins
     */
    public UpdatePoller(BotTransport transport, UpdateParser parser, Dispatcher dispatcher,
            BotConfig.PollingConfig config, UpdateOffsetStore offsetStore, PollerMonitor monitor,
            long initialOffset) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.config = config != null ? config : new BotConfig.PollingConfig();
        this.backoff = new Backoff.Policy(this.config.getInitialBackoffMs(),
                Math.max(this.config.getInitialBackoffMs(), this.config.getMaxBackoffMs()), 2.0, 0.1);
        this.offsetStore = offsetStore;
        this.monitor = monitor;
        this.offset = Math.max(0, initialOffset);
        if (offsetStore != null) {
            Long stored = offsetStore.read();
            if (stored != null && stored + 1 > this.offset) {
                this.offset = stored + 1;
            }
        }
        if (this.offset > 0) {
            log.info("Resuming polling from update {}", this.offset);
        }
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Start polling on a background daemon thread.
     *
     * @throws IllegalStateException if already running
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("poller already running");
        }
        Thread t = new Thread(() -> {
            try {
                runLoop();
            } catch (BotException e) {
                log.error("Polling ended with error: {}", e.getMessage(), e);
            }
        }, "botwire-poller");
        t.setDaemon(true);
        pollThread = t;
        t.start();
    }

    /**
     * Poll on the calling thread until {@link #stop()} or, with {@code nonStop=false}, the first
     * transport failure.
     *
     * @throws BotException the transport failure that ended the loop
     */
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("poller already running");
        }
        pollThread = Thread.currentThread();
        runLoop();
    }

    private void runLoop() {
        failure = null;
        log.info("Polling started (timeout={}s, limit={}, offset={})", config.getTimeoutSeconds(),
                config.getLimit(), offset);
        if (monitor != null) {
            monitor.recordPollingStarted();
        }
        try {
            loop();
        } finally {
            running.set(false);
            pollThread = null;
            if (monitor != null) {
                monitor.recordPollingStopped();
            }
            log.info("Polling stopped at offset {}", offset);
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Request a stop: the current long-poll is aborted and no further batch is fetched. Handlers
     * already running, inline or pooled, finish normally; the loop ends once the current batch is
     * handed off.
     */
    public void stop() {
        if (!running.getAndSet(false))
            return;
        transport.abortFetch();
    }

    /**
     * Like {@link #stop()}, but also interrupts the poll thread, so an inline handler running on it
     * is abandoned.
     */
    public void stopNow() {
        Thread t = pollThread;
        if (!running.getAndSet(false))
            return;
        transport.abortFetch();
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }

    /**
     * Wait for the background thread started by {@link #start()} to end.
     *
     * @return true if the loop has ended
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        Thread t = pollThread;
        if (t == null)
            return true;
        if (t == Thread.currentThread())
            return false;
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    @Override
    public void close() {
        stop();
        try {
            awaitStop(Duration.ofSeconds(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Next update id to request. */
    public long getOffset() {
        return offset;
    }

    /** The error that ended the last run, or null. */
    public BotException getFailure() {
        return failure;
    }

    // =========================================================================
    // Loop
    // =========================================================================

    private void loop() {
        int attempt = 0;
        boolean pendingSkipped = !config.isSkipPending();
        try {
            while (running.get()) {
                try {
                    if (!pendingSkipped) {
                        skipPending();
                        pendingSkipped = true;
                    }
                    pollOnce();
                    if (attempt > 0 && monitor != null) {
                        monitor.recordRecovered();
                    }
                    attempt = 0;
                    if (config.getIntervalMs() > 0) {
                        Backoff.sleepUnlessStopped(config.getIntervalMs(), () -> !running.get());
                    }
                } catch (BotException e) {
                    if (!running.get()) {
                        break;
                    }
                    if (monitor != null) {
                        monitor.recordError(e);
                    }
                    if (!config.isNonStop()) {
                        failure = e;
                        break;
                    }
                    attempt++;
                    long delay = retryDelay(e, attempt);
                    log.warn("Polling failed (attempt {}), retrying in {}ms: {}", attempt, delay,
                            ErrorUtils.formatErrorChain(e));
                    Backoff.sleepUnlessStopped(delay, () -> !running.get());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Poll thread interrupted");
        }
    }

    long retryDelay(BotException e, int attempt) {
        if (e instanceof RemoteApiException remote && remote.getRetryAfter() > 0) {
            return remote.getRetryAfter() * 1000L;
        }
        return Backoff.compute(backoff, attempt);
    }

    /**
     * Fetch one batch and hand it to the dispatcher.
     *
     * @return number of raw records received
     */
    int pollOnce() {
        List<JsonNode> records = transport.fetchUpdates(offset, config.getTimeoutSeconds(), config.getLimit(),
                config.getAllowedUpdates());
        if (records.isEmpty()) {
            return 0;
        }
        List<Update> batch = new ArrayList<>(records.size());
        long lastId = -1;
        for (JsonNode record : records) {
            try {
                Update update = parser.parse(record);
                batch.add(update);
                lastId = Math.max(lastId, update.getUpdateId());
            } catch (MalformedUpdateException e) {
                log.warn("Skipping malformed update {}: {}", e.getUpdateId(), e.getMessage());
                lastId = Math.max(lastId, e.getUpdateId());
            }
        }
        log.debug("Received {} update(s), {} dispatchable", records.size(), batch.size());
        if (lastId < 0) {
            log.warn("Received {} record(s) without an update_id; offset stays at {} and the server will resend them",
                    records.size(), offset);
        }

        dispatcher.dispatchBatch(batch);

        if (lastId >= offset) {
            advanceTo(lastId);
        }
        if (monitor != null) {
            monitor.recordUpdates(batch.size());
        }
        return records.size();
    }

    /**
     * Confirm everything pending without dispatching it.
     */
    void skipPending() {
        List<JsonNode> records = transport.fetchUpdates(-1, 0, 1, config.getAllowedUpdates());
        long lastId = -1;
        for (JsonNode record : records) {
            JsonNode id = record.get("update_id");
            if (id != null && id.canConvertToLong()) {
                lastId = Math.max(lastId, id.asLong());
            }
        }
        if (lastId >= 0) {
            advanceTo(lastId);
            log.info("Skipped pending updates up to {}", lastId);
        }
    }

    private void advanceTo(long lastUpdateId) {
        offset = lastUpdateId + 1;
        if (offsetStore == null)
            return;
        try {
            offsetStore.write(lastUpdateId);
        } catch (IOException e) {
            log.warn("Cannot persist update offset {}: {}", lastUpdateId, e.getMessage());
        }
    }
}
