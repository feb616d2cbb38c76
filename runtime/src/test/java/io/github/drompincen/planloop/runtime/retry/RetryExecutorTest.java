package io.github.drompincen.planloop.runtime.retry;

import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.drompincen.planloop.runtime.llm.ModelRejectedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class RetryExecutorTest {

    private final RetryExecutor fastExecutor =
            new RetryExecutor(3, Duration.ofMillis(1), 2.0, Duration.ofMillis(5));

    @Test
    void returnsFirstSuccessWithoutRetrying() {
        List<Integer> attempts = new ArrayList<>();

        String result = fastExecutor.execute("op", attempt -> {
            attempts.add(attempt);
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).containsExactly(1);
    }

    @Test
    void retriesUntilSuccessPassingAttemptNumbers() {
        List<Integer> attempts = new ArrayList<>();

        String result = fastExecutor.execute("op", attempt -> {
            attempts.add(attempt);
            if (attempt < 3) throw new IllegalStateException("boom " + attempt);
            return "third time";
        });

        assertThat(result).isEqualTo("third time");
        assertThat(attempts).containsExactly(1, 2, 3);
    }

    @Test
    void rejectionsAreRetriedLikeAnyOtherFailure() {
        List<Integer> attempts = new ArrayList<>();

        String result = fastExecutor.execute("op", attempt -> {
            attempts.add(attempt);
            if (attempt == 1) throw new ModelRejectedException("400 - bad request", null);
            return "recovered";
        });

        assertThat(result).isEqualTo("recovered");
        assertThat(attempts).containsExactly(1, 2);
    }

    @Test
    void rethrowsLastFailureAfterExhaustingAttempts() {
        List<RuntimeException> thrown = new ArrayList<>();

        Throwable failure = catchThrowable(() -> fastExecutor.execute("op", attempt -> {
            RuntimeException e = new IllegalStateException("failure " + attempt);
            thrown.add(e);
            throw e;
        }));

        assertThat(thrown).hasSize(3);
        assertThat(failure).isSameAs(thrown.get(2)).hasMessage("failure 3");
    }

    @Test
    void defaultScheduleIsTwoThenFourSeconds() {
        RetryExecutor executor = new RetryExecutor(new PlanloopProperties());

        assertThat(executor.maxAttempts()).isEqualTo(3);
        assertThat(executor.backoffBeforeAttempt(1)).isZero();
        assertThat(executor.backoffBeforeAttempt(2)).isEqualTo(2000);
        assertThat(executor.backoffBeforeAttempt(3)).isEqualTo(4000);
    }

    @Test
    void backoffIsCappedAtMaximum() {
        RetryExecutor executor = new RetryExecutor(6, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(10));

        assertThat(executor.backoffBeforeAttempt(4)).isEqualTo(8000);
        assertThat(executor.backoffBeforeAttempt(5)).isEqualTo(10000);
        assertThat(executor.backoffBeforeAttempt(6)).isEqualTo(10000);
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryExecutor(0, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
