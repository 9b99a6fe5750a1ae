package com.phillippitts.dialogaugment.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transform worker pool.
 *
 * <p>Defaults are small: the transform backend (TTS process, translation API) is the
 * bottleneck, not CPU.
 */
@ConfigurationProperties(prefix = "augment.threadpool")
@Validated
public class ThreadPoolProperties {

    @Positive(message = "Worker count must be positive")
    private int workers = 2;

    @Min(value = 0, message = "Queue capacity must not be negative")
    private int queueCapacity = 64;

    @Positive(message = "Keep-alive seconds must be positive")
    private int keepAliveSeconds = 60;

    @Positive(message = "Await termination seconds must be positive")
    private int awaitTerminationSeconds = 30;

    private String threadNamePrefix = "augment-worker-";

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getKeepAliveSeconds() {
        return keepAliveSeconds;
    }

    public void setKeepAliveSeconds(int keepAliveSeconds) {
        this.keepAliveSeconds = keepAliveSeconds;
    }

    public int getAwaitTerminationSeconds() {
        return awaitTerminationSeconds;
    }

    public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
        this.awaitTerminationSeconds = awaitTerminationSeconds;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
