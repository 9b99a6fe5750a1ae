package com.phillippitts.dialogaugment.service.execution;

import com.phillippitts.dialogaugment.config.properties.RetryProperties;
import com.phillippitts.dialogaugment.exception.TransientTransformException;
import com.phillippitts.dialogaugment.util.TimeUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded exponential backoff for transform work.
 *
 * <p>Attempt 1 runs immediately; the delay before attempt {@code k + 1} is
 * {@code min(cap, base * 2^(k - 1))}. Delays never decrease. Only
 * {@link TransientTransformException} is retried.
 *
 * <p>The policy is applied through a Spring Retry {@link RetryTemplate} built by
 * {@link #newTemplate(Sleeper)}.
 */
@Component
public class RetryPolicy {

    private static final double MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final Duration base;
    private final Duration cap;

    @Autowired
    public RetryPolicy(RetryProperties props) {
        this(props.getMaxAttempts(), props.getBackoffBase(), props.getBackoffCap());
    }

    public RetryPolicy(int maxAttempts, Duration base, Duration cap) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.base = Objects.requireNonNull(base, "base");
        this.cap = Objects.requireNonNull(cap, "cap");
        if (base.isNegative() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("require 0 <= base <= cap");
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay to wait before running {@code attempt} (1-based).
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        return TimeUtils.doubledAndCapped(base, attempt - 2, cap);
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Template that pauses on the calling thread between attempts.
     */
    public RetryTemplate newTemplate() {
        return newTemplate(new ThreadWaitSleeper());
    }

    /**
     * Template applying this policy. Spring Retry waits at least 1 ms between attempts,
     * so a zero base still yields 1 ms pauses.
     *
     * @param sleeper performs the backoff pauses
     */
    public RetryTemplate newTemplate(Sleeper sleeper) {
        SimpleRetryPolicy attempts = new SimpleRetryPolicy(maxAttempts,
                Map.<Class<? extends Throwable>, Boolean>of(TransientTransformException.class, true));

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(base.toMillis());
        backOff.setMultiplier(MULTIPLIER);
        backOff.setMaxInterval(cap.toMillis());
        backOff.setSleeper(Objects.requireNonNull(sleeper, "sleeper"));

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(attempts);
        template.setBackOffPolicy(backOff);
        return template;
    }
}
