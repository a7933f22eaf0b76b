package com.botwire.dispatch.poller;

import com.botwire.api.binding.BotJson;
import com.botwire.api.binding.JacksonUpdateParser;
import com.botwire.api.errors.RemoteApiException;
import com.botwire.api.errors.TransportException;
import com.botwire.api.types.UpdateKind;
import com.botwire.common.config.BotConfig;
import com.botwire.dispatch.DispatchMode;
import com.botwire.dispatch.Dispatcher;
import com.botwire.dispatch.HandlerRegistry;
import com.botwire.dispatch.ScriptedTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class UpdatePollerTest {

    private final ScriptedTransport transport = new ScriptedTransport();
    private final HandlerRegistry registry = new HandlerRegistry();
    private final List<Long> handled = Collections.synchronizedList(new ArrayList<>());
    private Dispatcher dispatcher = new Dispatcher(registry);

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private BotConfig.PollingConfig config() {
        BotConfig.PollingConfig config = new BotConfig.PollingConfig();
        config.setTimeoutSeconds(0);
        config.setInitialBackoffMs(1);
        config.setMaxBackoffMs(5);
        return config;
    }

    private UpdatePoller poller(BotConfig.PollingConfig config) {
        return new UpdatePoller(transport, new JacksonUpdateParser(), dispatcher, config);
    }

    private void recordHandled() {
        registry.register(UpdateKind.MESSAGE, (u, c) -> handled.add(u.getUpdateId()), List.of());
    }

    static JsonNode message(long updateId) {
        ObjectNode chat = BotJson.mapper().createObjectNode().put("id", 42).put("type", "private");
        ObjectNode msg = BotJson.mapper().createObjectNode().put("message_id", updateId).put("date", 1)
                .put("text", "m" + updateId);
        msg.set("chat", chat);
        ObjectNode record = BotJson.mapper().createObjectNode().put("update_id", updateId);
        record.set("message", msg);
        return record;
    }

    static JsonNode noPayload(long updateId) {
        return BotJson.mapper().createObjectNode().put("update_id", updateId);
    }

    @Test
    void pollOnce_dispatchesInOrderAndAdvancesOffset() {
        recordHandled();
        transport.script.add(List.of(message(10), message(11), message(12)));
        UpdatePoller poller = poller(config());

        assertEquals(3, poller.pollOnce());

        assertEquals(List.of(10L, 11L, 12L), handled);
        assertEquals(13, poller.getOffset());
        assertEquals(List.of(0L), transport.offsets);
    }

    @Test
    void malformedRecord_skippedButOffsetMovesPastIt() {
        recordHandled();
        transport.script.add(List.of(message(1), message(2), noPayload(3), message(4), message(5)));
        UpdatePoller poller = poller(config());

        poller.pollOnce();

        assertEquals(List.of(1L, 2L, 4L, 5L), handled);
        assertEquals(6, poller.getOffset());
    }

    @Test
    void emptyBatch_keepsOffset() {
        UpdatePoller poller = poller(config());
        transport.script.add(List.of());

        assertEquals(0, poller.pollOnce());
        assertEquals(0, poller.getOffset());
    }

    @Test
    void pooledMode_offsetAdvancesWhileHandlersAreBlocked() throws Exception {
        dispatcher = new Dispatcher(registry, DispatchMode.POOLED, 2, true, false);
        CountDownLatch release = new CountDownLatch(1);
        registry.register(UpdateKind.MESSAGE, (u, c) -> {
            release.await(5, TimeUnit.SECONDS);
            handled.add(u.getUpdateId());
        }, List.of());
        transport.script.add(List.of(message(7), message(8)));
        UpdatePoller poller = poller(config());

        poller.pollOnce();

        assertEquals(9, poller.getOffset());
        assertTrue(handled.isEmpty());
        release.countDown();
        dispatcher.shutdown();
        assertTrue(dispatcher.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(2, handled.size());
    }

    @Test
    void skipPending_requestsNewestAndMovesPastIt() {
        transport.script.add(List.of(message(41)));
        UpdatePoller poller = poller(config());

        poller.skipPending();

        assertEquals(List.of(-1L), transport.offsets);
        assertEquals(List.of(1), transport.limits);
        assertEquals(42, poller.getOffset());
    }

    @Test
    void nonStopFalse_firstFailureEndsRun() {
        BotConfig.PollingConfig config = config();
        config.setNonStop(false);
        transport.script.add(new TransportException("connection reset"));
        UpdatePoller poller = poller(config);

        var ex = assertThrows(TransportException.class, poller::run);

        assertEquals("connection reset", ex.getMessage());
        assertSame(ex, poller.getFailure());
        assertFalse(poller.isRunning());
    }

    @Test
    void nonStop_retriesAfterFailureThenDispatches() throws Exception {
        recordHandled();
        transport.script.add(new TransportException("connection reset"));
        transport.script.add(new RemoteApiException("getUpdates", 502, "Bad Gateway", 0));
        transport.script.add(List.of(message(3)));
        PollerMonitor monitor = new PollerMonitor("1");
        UpdatePoller poller = new UpdatePoller(transport, new JacksonUpdateParser(), dispatcher, config(), null,
                monitor);

        poller.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (handled.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        poller.stop();
        assertTrue(poller.awaitStop(Duration.ofSeconds(5)));

        assertEquals(List.of(3L), handled);
        assertEquals(4, poller.getOffset());
        assertNull(poller.getFailure());
        assertEquals(1, monitor.getHealthStatus().updateCount());
        assertEquals(PollerMonitor.Status.STOPPED, monitor.getHealthStatus().status());
    }

    @Test
    void retryDelay_honoursRetryAfter() {
        UpdatePoller poller = poller(config());

        assertEquals(7000, poller.retryDelay(new RemoteApiException("getUpdates", 429, "Too Many Requests", 7), 1));
        long backoff = poller.retryDelay(new TransportException("reset"), 3);
        assertTrue(backoff >= 1 && backoff <= 6, "backoff " + backoff);
    }

    @Test
    void start_twice_rejected() {
        UpdatePoller poller = poller(config());
        poller.start();
        try {
            assertThrows(IllegalStateException.class, poller::start);
        } finally {
            poller.close();
        }
        assertFalse(poller.isRunning());
        assertTrue(transport.aborted.get() > 0);
    }

    @Test
    void offsetStore_resumesAndPersists(@TempDir Path dir) throws Exception {
        UpdateOffsetStore store = UpdateOffsetStore.forBot(dir, "123:abc");
        store.write(99);
        transport.script.add(List.of(message(100), message(101)));
        UpdatePoller poller = new UpdatePoller(transport, new JacksonUpdateParser(), dispatcher, config(), store,
                null);

        assertEquals(100, poller.getOffset());
        poller.pollOnce();

        assertEquals(List.of(100L), transport.offsets);
        assertEquals(101L, store.read());
    }

    @Test
    void initialOffset_usedUnlessStoreIsAhead(@TempDir Path dir) throws Exception {
        UpdatePoller fresh = new UpdatePoller(transport, new JacksonUpdateParser(), dispatcher, config(), null,
                null, 11);
        assertEquals(11, fresh.getOffset());

        UpdateOffsetStore store = UpdateOffsetStore.forBot(dir, "123:abc");
        store.write(99);
        UpdatePoller behindStore = new UpdatePoller(transport, new JacksonUpdateParser(), dispatcher, config(),
                store, null, 50);
        UpdatePoller aheadOfStore = new UpdatePoller(transport, new JacksonUpdateParser(), dispatcher, config(),
                store, null, 200);

        assertEquals(100, behindStore.getOffset());
        assertEquals(200, aheadOfStore.getOffset());
    }

    @Test
    void recordsWithoutUpdateId_leaveOffsetUnchanged() {
        recordHandled();
        ObjectNode anonymous = (ObjectNode) message(5);
        anonymous.remove("update_id");
        transport.script.add(List.of(anonymous));
        UpdatePoller poller = poller(config());

        assertEquals(1, poller.pollOnce());

        assertTrue(handled.isEmpty());
        assertEquals(0, poller.getOffset());
    }

    @Test
    void stop_letsRunningInlineHandlerFinish() throws Exception {
        AtomicReference<String> outcome = runSlowHandlerThen(UpdatePoller::stop);

        assertEquals("completed", outcome.get());
    }

    @Test
    void stopNow_interruptsRunningInlineHandler() throws Exception {
        AtomicReference<String> outcome = runSlowHandlerThen(UpdatePoller::stopNow);

        assertEquals("interrupted", outcome.get());
    }

    private AtomicReference<String> runSlowHandlerThen(Consumer<UpdatePoller> stopper)
            throws Exception {
        AtomicReference<String> outcome = new AtomicReference<>("not run");
        CountDownLatch entered = new CountDownLatch(1);
        registry.register(UpdateKind.MESSAGE, (u, c) -> {
            entered.countDown();
            try {
                Thread.sleep(300);
                outcome.set("completed");
            } catch (InterruptedException e) {
                outcome.set("interrupted");
                Thread.currentThread().interrupt();
            }
        }, List.of());
        transport.script.add(List.of(message(1)));
        UpdatePoller poller = poller(config());

        poller.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        stopper.accept(poller);
        assertTrue(poller.awaitStop(Duration.ofSeconds(5)));

        assertEquals(2, poller.getOffset());
        return outcome;
    }
}
