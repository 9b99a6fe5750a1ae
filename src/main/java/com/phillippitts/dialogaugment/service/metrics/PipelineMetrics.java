package com.phillippitts.dialogaugment.service.metrics;

import com.phillippitts.dialogaugment.domain.UnitOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the augmentation pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Transform latency per transform</li>
 *   <li>Unit outcomes (created, reused, failed) and retried attempts</li>
 *   <li>Shard commits and decode failures</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "augment.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one successful transform invocation.
     *
     * @param transformName transform identifier
     * @param durationNanos duration in nanoseconds
     */
    public void recordTransformLatency(String transformName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transform.latency")
                .description("Time taken by one transform invocation")
                .tag("transform", transformName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordOutcome(String transformName, UnitOutcome.Kind kind) {
        Counter.builder(METRIC_PREFIX + ".units")
                .description("Work units by terminal outcome")
                .tag("transform", transformName)
                .tag("outcome", kind.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * Counts an attempt that failed transiently and will be retried.
     */
    public void incrementRetry(String transformName) {
        Counter.builder(METRIC_PREFIX + ".retries")
                .description("Transient transform failures that were retried")
                .tag("transform", transformName)
                .register(registry)
                .increment();
    }

    public void incrementShardsCommitted(int count) {
        Counter.builder(METRIC_PREFIX + ".shards.committed")
                .description("Shards recorded as completed in the checkpoint")
                .register(registry)
                .increment(count);
    }

    public void incrementDecodeFailures() {
        Counter.builder(METRIC_PREFIX + ".shards.decode_failed")
                .description("Shards skipped because they could not be parsed")
                .register(registry)
                .increment();
    }
}
