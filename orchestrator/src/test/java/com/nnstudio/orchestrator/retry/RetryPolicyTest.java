package com.nnstudio.orchestrator.retry;

import com.nnstudio.orchestrator.client.RemoteCallException;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RetryPolicy.
 *
 * Jitter is replaced with the identity so waits equal the backoff ceiling,
 * and sleeps are recorded instead of performed.
 */
class RetryPolicyTest {

    RecordingSleeper   sleeper;
    SimpleMeterRegistry meters;
    RetryPolicy        policy;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        meters  = new SimpleMeterRegistry();
        policy  = new RetryPolicy(3, 1000, 30_000, sleeper, meters, bound -> bound);
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    @Test
    void withRetry_clientError_failsAfterOneCall() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.withRetry("submit", () -> {
            calls.incrementAndGet();
            throw new RemoteCallException(404, "not found");
        })).isInstanceOf(RemoteCallException.class)
           .isNotInstanceOf(RetryExhaustedException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void withRetry_rateLimited_retriesUpToMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.withRetry("poll", () -> {
            calls.incrementAndGet();
            throw new RemoteCallException(429, "slow down");
        })).isInstanceOf(RetryExhaustedException.class)
           .satisfies(e -> {
               RetryExhaustedException rex = (RetryExhaustedException) e;
               assertThat(rex.attempts()).isEqualTo(3);
               assertThat(rex.statusCode()).isEqualTo(429);
               assertThat(rex.operation()).isEqualTo("poll");
           });

        assertThat(calls.get()).isEqualTo(3);
        // no sleep after the final attempt
        assertThat(sleeper.sleeps()).containsExactly(1000L, 2000L);
    }

    @Test
    void withRetry_serverErrorThenSuccess_returnsValue() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.withRetry("fetch", () -> {
            if (calls.incrementAndGet() < 3) throw new RemoteCallException(503, "unavailable");
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(meters.counter("nn.retry.attempts", "operation", "fetch").count()).isEqualTo(2.0);
    }

    @Test
    void withRetry_ioError_isRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.withRetry("submit", () -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        })).isInstanceOf(RetryExhaustedException.class)
           .hasCauseInstanceOf(IOException.class);

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void withRetry_problemWithClientStatus_isNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        ProblemException problem = new ProblemException(Problem.of("Bad", "bad input", 400));

        assertThatThrownBy(() -> policy.withRetry("submit", () -> {
            calls.incrementAndGet();
            throw problem;
        })).isSameAs(problem);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void withRetry_itemIdsInOperation_shareOneMetricTag() {
        AtomicInteger calls = new AtomicInteger();

        policy.withRetry("generate-0-1-123", () -> {
            if (calls.incrementAndGet() == 1) throw new RemoteCallException(500, "boom");
            return 1;
        });

        assertThat(meters.counter("nn.retry.attempts", "operation", "generate").count()).isEqualTo(1.0);
    }

    @Test
    void withRetry_interruptedWhileWaiting_restoresFlagAndStops() {
        RetryPolicy interrupting = new RetryPolicy(3, 1000, 30_000,
                millis -> { throw new InterruptedException(); }, meters, bound -> bound);
        AtomicInteger calls = new AtomicInteger();

        try {
            assertThatThrownBy(() -> interrupting.withRetry("poll", () -> {
                calls.incrementAndGet();
                throw new RemoteCallException(500, "boom");
            })).isInstanceOf(RetryExhaustedException.class);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();   // clear for other tests
        }
    }

    // ------------------------------------------------------------------
    // Backoff
    // ------------------------------------------------------------------

    @Test
    void computeDelay_growsExponentiallyAndIsCapped() {
        assertThat(policy.computeDelay(0, 1000)).isEqualTo(1000);
        assertThat(policy.computeDelay(1, 1000)).isEqualTo(2000);
        assertThat(policy.computeDelay(4, 1000)).isEqualTo(16_000);
        assertThat(policy.computeDelay(5, 1000)).isEqualTo(30_000);
        assertThat(policy.computeDelay(62, 1000)).isEqualTo(30_000);
    }

    @Test
    void isRetryable_classifiesByStatus() {
        assertThat(RetryPolicy.isRetryable(new RemoteCallException(0, "timeout"))).isTrue();
        assertThat(RetryPolicy.isRetryable(new RemoteCallException(500, "x"))).isTrue();
        assertThat(RetryPolicy.isRetryable(new RemoteCallException(429, "x"))).isTrue();
        assertThat(RetryPolicy.isRetryable(new RemoteCallException(403, "x"))).isFalse();
        assertThat(RetryPolicy.isRetryable(new IllegalArgumentException("x"))).isFalse();
    }
}
