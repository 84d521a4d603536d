package com.nnstudio.orchestrator.retry;

import com.nnstudio.orchestrator.client.RemoteCallException;
import com.nnstudio.orchestrator.problem.ProblemException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Truncated exponential backoff with full jitter.
 *
 * <pre>
 *   delay(attempt) = min(baseDelay * 2^attempt, maxDelay)
 *   wait           = uniform[0, delay)
 * </pre>
 *
 * Client errors (4xx except 429) fail immediately. Everything else
 * (5xx, 429, timeouts, I/O errors) is retried until {@code maxAttempts}
 * calls have been made, then surfaced as {@link RetryExhaustedException}.
 */
@Component
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int  DEFAULT_MAX_ATTEMPTS  = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS  = 30_000;

    private final int               maxAttempts;
    private final long              baseDelayMs;
    private final long              maxDelayMs;
    private final Sleeper           sleeper;
    private final LongUnaryOperator jitter;
    private final MeterRegistry     meterRegistry;

    @Autowired
    public RetryPolicy(@Value("${nn.retry.max-attempts:3}") int maxAttempts,
                       @Value("${nn.retry.base-delay-ms:1000}") long baseDelayMs,
                       @Value("${nn.retry.max-delay-ms:30000}") long maxDelayMs,
                       Sleeper sleeper, MeterRegistry meterRegistry) {
        this(maxAttempts, baseDelayMs, maxDelayMs, sleeper, meterRegistry,
                bound -> bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound));
    }

    RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs,
                Sleeper sleeper, MeterRegistry meterRegistry, LongUnaryOperator jitter) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts   = maxAttempts;
        this.baseDelayMs   = baseDelayMs;
        this.maxDelayMs    = maxDelayMs;
        this.sleeper       = sleeper;
        this.meterRegistry = meterRegistry;
        this.jitter        = jitter;
    }

    public <T> T withRetry(String operation, Callable<T> call) {
        return withRetry(operation, call, maxAttempts, baseDelayMs);
    }

    public <T> T withRetry(String operation, Callable<T> call, int attempts, long baseDelay) {
        Exception last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return call.call();
            } catch (Exception e) {
                last = e;
                if (!isRetryable(e)) {
                    throw propagate(e);
                }
                if (attempt == attempts - 1) {
                    break;
                }
                long delay = computeDelay(attempt, baseDelay);
                long wait  = jitter.applyAsLong(delay);
                log.warn("Retrying {} (attempt {}/{}) in {} ms: {}",
                        operation, attempt + 1, attempts, wait, e.getMessage());
                meterRegistry.counter("nn.retry.attempts", "operation", metricName(operation)).increment();
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(operation, attempt + 1, statusOf(e), ie);
                }
            }
        }
        throw new RetryExhaustedException(operation, attempts, statusOf(last), last);
    }

    /** Backoff ceiling before jitter for the given zero-based attempt. */
    public long computeDelay(int attempt, long baseDelay) {
        // 2^30 already exceeds any sensible cap; avoids long overflow on large attempt counts
        long factor = 1L << Math.min(attempt, 30);
        long delay  = baseDelay > maxDelayMs / factor ? maxDelayMs : baseDelay * factor;
        return Math.min(delay, maxDelayMs);
    }

    public static boolean isRetryable(Throwable e) {
        if (e instanceof RemoteCallException rce) {
            return !rce.isClientError();
        }
        if (e instanceof ProblemException pe) {
            return pe.status() >= 500 || pe.status() == 429;
        }
        return !(e instanceof IllegalArgumentException);
    }

    public int maxAttempts() { return maxAttempts; }

    private static int statusOf(Throwable e) {
        if (e instanceof RemoteCallException rce) return rce.statusCode();
        if (e instanceof ProblemException pe) return pe.status();
        return 0;
    }

    private static RuntimeException propagate(Exception e) {
        if (e instanceof RuntimeException re) return re;
        return new RemoteCallException(0, e.getMessage(), e);
    }

    // operation names carry item ids ("generate-3-1"); keep metric tag cardinality low
    private static String metricName(String operation) {
        int dash = operation.indexOf('-');
        return dash > 0 ? operation.substring(0, dash) : operation;
    }
}
