package com.phillippitts.dialogaugment.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Retry and backoff settings shared by transform execution and transform initialization.
 *
 * <p>Properties:
 * <ul>
 *   <li>augment.retry.max-attempts - attempts per unit, including the first (default: 3)</li>
 *   <li>augment.retry.backoff-base - delay before the second attempt (default: 4s)</li>
 *   <li>augment.retry.backoff-cap - upper bound for any single delay (default: 10s)</li>
 *   <li>augment.retry.checkpoint-write-attempts - checkpoint write attempts (default: 3)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "augment.retry")
@Validated
public class RetryProperties {

    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 3;

    @NotNull
    private Duration backoffBase = Duration.ofSeconds(4);

    @NotNull
    private Duration backoffCap = Duration.ofSeconds(10);

    @Positive(message = "Checkpoint write attempts must be positive")
    private int checkpointWriteAttempts = 3;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffCap() {
        return backoffCap;
    }

    public void setBackoffCap(Duration backoffCap) {
        this.backoffCap = backoffCap;
    }

    public int getCheckpointWriteAttempts() {
        return checkpointWriteAttempts;
    }

    public void setCheckpointWriteAttempts(int checkpointWriteAttempts) {
        this.checkpointWriteAttempts = checkpointWriteAttempts;
    }
}
