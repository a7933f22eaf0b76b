package com.botwire.common.infra;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void compute_doublesUntilCap() {
        var policy = new Backoff.Policy(1000, 30_000, 2.0, 0.0);

        assertEquals(1000, Backoff.compute(policy, 1));
        assertEquals(2000, Backoff.compute(policy, 2));
        assertEquals(16_000, Backoff.compute(policy, 5));
        assertEquals(30_000, Backoff.compute(policy, 6));
        assertEquals(30_000, Backoff.compute(policy, 500));
    }

    @Test
    void compute_jitterStaysWithinRatio() {
        var policy = new Backoff.Policy(1000, 30_000, 2.0, 0.5);
        for (int i = 0; i < 50; i++) {
            long d = Backoff.compute(policy, 1);
            assertTrue(d >= 1000 && d <= 1500, "delay " + d);
        }
    }

    @Test
    void policy_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new Backoff.Policy(0, 10, 2.0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Backoff.Policy(100, 10, 2.0, 0));
    }

    @Test
    void sleepUnlessStopped_returnsEarlyWhenStopped() throws InterruptedException {
        var stopped = new AtomicBoolean(true);
        long start = System.currentTimeMillis();

        assertFalse(Backoff.sleepUnlessStopped(10_000, stopped::get));
        assertTrue(System.currentTimeMillis() - start < 1000);
    }

    @Test
    void sleepUnlessStopped_completesFullDelay() throws InterruptedException {
        assertTrue(Backoff.sleepUnlessStopped(20, () -> false));
    }
}
