package com.botwire.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.ToLongFunction;

/**
 * Bounded retry of a single call with exponential backoff and server-supplied retry delays.
 */
@Slf4j
public final class RetryRunner {

    /**
     * @param attempts   maximum number of attempts (>= 1)
     * @param minDelayMs delay before the second attempt
     * @param maxDelayMs delay ceiling
     * @param jitter     jitter ratio (0..1)
     */
    public record Config(int attempts, long minDelayMs, long maxDelayMs, double jitter) {

        public static final Config DEFAULT = new Config(3, 500, 30_000, 0.1);

        public Config {
            attempts = Math.max(1, attempts);
            minDelayMs = Math.max(0, minDelayMs);
            maxDelayMs = Math.max(minDelayMs, maxDelayMs);
            jitter = Math.max(0.0, Math.min(1.0, jitter));
        }
    }

    public record RetryInfo(int attempt, int maxAttempts, long delayMs, Exception err, String label) {
    }

    private final Config config;
    private final BiPredicate<Exception, Integer> shouldRetry;
    private final ToLongFunction<Exception> retryAfterMs;
    private final Consumer<RetryInfo> onRetry;

    /**
     * @param shouldRetry  decides whether a failure is worth another attempt; null retries everything
     * @param retryAfterMs server-requested delay for a failure, or a value {@code <= 0} for none; may be null
     * @param onRetry      notified before each sleep; null logs at warn
     */
    public RetryRunner(Config config,
            BiPredicate<Exception, Integer> shouldRetry,
            ToLongFunction<Exception> retryAfterMs,
            Consumer<RetryInfo> onRetry) {
        this.config = config != null ? config : Config.DEFAULT;
        this.shouldRetry = shouldRetry != null ? shouldRetry : (err, attempt) -> true;
        this.retryAfterMs = retryAfterMs;
        this.onRetry = onRetry != null ? onRetry : RetryRunner::logRetry;
    }

    public RetryRunner(Config config) {
        this(config, null, null, null);
    }

    /**
     * Run {@code fn} until it succeeds, the attempts run out, or {@code shouldRetry} declines.
     *
     * @throws Exception the last failure
     */
    public <T> T execute(Callable<T> fn, String label) throws Exception {
        Exception lastErr = null;
        for (int attempt = 1; attempt <= config.attempts(); attempt++) {
            try {
                return fn.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception err) {
                lastErr = err;
                if (attempt >= config.attempts() || !shouldRetry.test(err, attempt)) {
                    break;
                }
                long delay = delayFor(err, attempt);
                onRetry.accept(new RetryInfo(attempt, config.attempts(), delay, err, label));
                Thread.sleep(delay);
            }
        }
        throw lastErr;
    }

    long delayFor(Exception err, int attempt) {
        long serverDelay = retryAfterMs != null ? retryAfterMs.applyAsLong(err) : -1;
        if (serverDelay > 0) {
            // The server's delay wins over the ceiling.
            return Math.max(serverDelay, config.minDelayMs());
        }
        long base = config.minDelayMs() * (1L << Math.min(attempt - 1, 30));
        long delay = Math.min(base, config.maxDelayMs());
        if (config.jitter() > 0) {
            double offset = (ThreadLocalRandom.current().nextDouble() * 2 - 1) * config.jitter();
            delay = Math.round(delay * (1 + offset));
        }
        return Math.min(Math.max(delay, config.minDelayMs()), config.maxDelayMs());
    }

    private static void logRetry(RetryInfo info) {
        log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                info.label() != null ? info.label() : "call", info.attempt(), info.maxAttempts(),
                info.delayMs(), ErrorUtils.formatErrorChain(info.err()));
    }
}
