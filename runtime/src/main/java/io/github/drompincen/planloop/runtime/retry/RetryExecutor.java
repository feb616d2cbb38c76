package io.github.drompincen.planloop.runtime.retry;

import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Runs an operation with bounded exponential backoff. Every {@link RuntimeException} is
 * retried; once attempts are exhausted the last failure is rethrown unchanged.
 * <p>
 * The operation receives the 1-based attempt number so it can record each attempt.
 */
@Component
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final int maxAttempts;
    private final IntervalFunction intervals;
    private final RetryConfig config;

    @Autowired
    public RetryExecutor(PlanloopProperties properties) {
        this(properties.getRetry().getMaxAttempts(),
                properties.getRetry().getInitialBackoff(),
                properties.getRetry().getMultiplier(),
                properties.getRetry().getMaxBackoff());
    }

    public RetryExecutor(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.intervals = IntervalFunction.ofExponentialBackoff(
                initialBackoff.toMillis(), multiplier, maxBackoff.toMillis());
        this.config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervals)
                .retryOnException(e -> true)
                .build();
    }

    public <T> T execute(String operation, IntFunction<T> attempt) {
        Retry retry = Retry.of(operation, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{} attempt {} failed ({}), retrying in {} ms",
                operation, event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown",
                event.getWaitInterval().toMillis()));

        AtomicInteger attemptNumber = new AtomicInteger();
        Supplier<T> decorated = Retry.decorateSupplier(retry, () -> attempt.apply(attemptNumber.incrementAndGet()));
        try {
            return decorated.get();
        } catch (RuntimeException e) {
            log.error("{} failed after {} attempt(s): {}", operation, attemptNumber.get(), e.getMessage());
            throw e;
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** Delay slept before the given attempt; zero for the first one. */
    public long backoffBeforeAttempt(int attemptNumber) {
        if (attemptNumber <= 1) return 0;
        return intervals.apply(attemptNumber - 1);
    }
}
