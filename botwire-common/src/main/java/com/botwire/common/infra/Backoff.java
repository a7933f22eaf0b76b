package com.botwire.common.infra;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

/**
 * Exponential backoff computation and stoppable sleep.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy.
     *
     * @param initialMs first delay in milliseconds
     * @param maxMs     delay ceiling in milliseconds
     * @param factor    multiplier per attempt
     * @param jitter    jitter ratio (0..1)
     */
    public record Policy(long initialMs, long maxMs, double factor, double jitter) {

        /** Poll-loop default: 1s initial, 30s max, doubling, no jitter. */
        public static final Policy DEFAULT = new Policy(1000, 30_000, 2.0, 0.0);

        public Policy {
            if (initialMs <= 0 || maxMs < initialMs || factor < 1.0) {
                throw new IllegalArgumentException("invalid backoff policy: initial=" + initialMs
                        + " max=" + maxMs + " factor=" + factor);
            }
            jitter = Math.max(0.0, Math.min(1.0, jitter));
        }
    }

    /**
     * Compute the delay for a given attempt.
     *
     * @param attempt 1-based attempt number
     * @return delay in milliseconds, capped at {@code policy.maxMs}
     */
    public static long compute(Policy policy, int attempt) {
        double base = policy.initialMs() * Math.pow(policy.factor(), Math.max(attempt - 1, 0));
        double jitter = base * policy.jitter() * ThreadLocalRandom.current().nextDouble();
        return Math.min(policy.maxMs(), Math.round(Math.min(base + jitter, (double) Long.MAX_VALUE)));
    }

    /**
     * Sleep in small slices, returning early once {@code stopped} reports true.
     *
     * @return {@code true} if the full delay elapsed, {@code false} if stopped early
     * @throws InterruptedException if the thread is interrupted during sleep
     */
    public static boolean sleepUnlessStopped(long ms, BooleanSupplier stopped) throws InterruptedException {
        if (ms <= 0) {
            return stopped == null || !stopped.getAsBoolean();
        }
        long deadline = System.currentTimeMillis() + ms;
        long remaining = ms;
        while (remaining > 0) {
            if (stopped != null && stopped.getAsBoolean()) {
                return false;
            }
            Thread.sleep(Math.min(remaining, 100));
            remaining = deadline - System.currentTimeMillis();
        }
        return stopped == null || !stopped.getAsBoolean();
    }
}
