package com.botwire.common.infra;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryRunnerTest {

    @Test
    void execute_succeedsAfterFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<RetryRunner.RetryInfo> retries = new ArrayList<>();
        var runner = new RetryRunner(new RetryRunner.Config(3, 1, 5, 0), null, null, retries::add);

        String result = runner.execute(() -> {
            if (calls.incrementAndGet() < 3)
                throw new IOException("flaky");
            return "ok";
        }, "setWebhook");

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(2, retries.size());
        assertEquals("setWebhook", retries.get(0).label());
    }

    @Test
    void execute_rethrowsLastFailure() {
        var runner = new RetryRunner(new RetryRunner.Config(2, 1, 5, 0), null, null, info -> {
        });

        var ex = assertThrows(IOException.class, () -> runner.execute(() -> {
            throw new IOException("down");
        }, null));
        assertEquals("down", ex.getMessage());
    }

    @Test
    void execute_shouldRetryFalse_stopsImmediately() {
        AtomicInteger calls = new AtomicInteger();
        var runner = new RetryRunner(new RetryRunner.Config(5, 1, 5, 0),
                (err, attempt) -> !(err instanceof IllegalStateException), null, info -> {
                });

        assertThrows(IllegalStateException.class, () -> runner.execute(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("fatal");
        }, null));
        assertEquals(1, calls.get());
    }

    @Test
    void delayFor_prefersServerDelay() {
        var runner = new RetryRunner(new RetryRunner.Config(3, 100, 1000, 0), null, err -> 5000, null);

        assertEquals(5000, runner.delayFor(new IOException(), 1));
    }

    @Test
    void delayFor_exponentialWithinBounds() {
        var runner = new RetryRunner(new RetryRunner.Config(5, 100, 300, 0));

        assertEquals(100, runner.delayFor(new IOException(), 1));
        assertEquals(200, runner.delayFor(new IOException(), 2));
        assertEquals(300, runner.delayFor(new IOException(), 3));
    }
}
