package com.botwire.dispatch.poller;

import com.botwire.api.errors.TransportException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PollerMonitorTest {

    private final AtomicLong now = new AtomicLong(1_000_000);
    private final PollerMonitor monitor = new PollerMonitor("123", 60_000, now::get);

    @Test
    void initialState_idleAndNotStalled() {
        now.addAndGet(120_000);

        assertEquals(PollerMonitor.Status.IDLE, monitor.getHealthStatus().status());
        assertFalse(monitor.isStalled());
    }

    @Test
    void updates_markActiveAndCount() {
        monitor.recordPollingStarted();
        monitor.recordUpdates(3);
        monitor.recordUpdates(0);
        monitor.recordUpdates(2);

        var health = monitor.getHealthStatus();
        assertEquals(PollerMonitor.Status.ACTIVE, health.status());
        assertEquals(5, health.updateCount());
        assertEquals("123", health.botId());
    }

    @Test
    void stalled_whenQuietPastThreshold() {
        monitor.recordPollingStarted();
        now.addAndGet(59_000);
        assertFalse(monitor.isStalled());

        now.addAndGet(2_000);
        assertTrue(monitor.isStalled());

        monitor.recordUpdates(1);
        assertFalse(monitor.isStalled());

        now.addAndGet(61_000);
        assertTrue(monitor.getHealthStatus().stalled());
    }

    @Test
    void error_thenRecovered() {
        monitor.recordPollingStarted();
        monitor.recordError(new TransportException("timeout"));

        assertEquals(PollerMonitor.Status.ERROR, monitor.getHealthStatus().status());
        assertEquals("timeout", monitor.getHealthStatus().lastError());
        now.addAndGet(120_000);
        assertFalse(monitor.isStalled());

        monitor.recordRecovered();
        assertEquals(PollerMonitor.Status.POLLING, monitor.getHealthStatus().status());
    }

    @Test
    void recovered_withoutError_keepsStatus() {
        monitor.recordPollingStarted();
        monitor.recordUpdates(1);
        monitor.recordRecovered();

        assertEquals(PollerMonitor.Status.ACTIVE, monitor.getHealthStatus().status());
    }

    @Test
    void stopped_neverStalled() {
        monitor.recordPollingStarted();
        monitor.recordPollingStopped();
        now.addAndGet(120_000);

        assertFalse(monitor.isStalled());
        assertEquals(PollerMonitor.Status.STOPPED, monitor.getHealthStatus().status());
    }
}
