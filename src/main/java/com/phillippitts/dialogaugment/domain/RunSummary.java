package com.phillippitts.dialogaugment.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one pipeline run.
 */
public final class RunSummary {

    private final String runId;
    private final String transformName;
    private final Instant startedAt;
    private Instant finishedAt;
    private final Map<String, ShardReport> shards = new LinkedHashMap<>();
    private boolean interrupted;

    public RunSummary(String runId, String transformName, Instant startedAt) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.transformName = Objects.requireNonNull(transformName, "transformName");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public ShardReport shard(String shardId) {
        return shards.computeIfAbsent(shardId, ShardReport::new);
    }

    public void markInterrupted() {
        this.interrupted = true;
    }

    public void finish(Instant at) {
        this.finishedAt = at;
    }

    public String runId() {
        return runId;
    }

    public String transformName() {
        return transformName;
    }

    public List<ShardReport> shards() {
        return Collections.unmodifiableList(new ArrayList<>(shards.values()));
    }

    public boolean interrupted() {
        return interrupted;
    }

    public int totalSucceeded() {
        return shards.values().stream().mapToInt(ShardReport::succeeded).sum();
    }

    public int totalCreated() {
        return shards.values().stream().mapToInt(ShardReport::created).sum();
    }

    public int totalReused() {
        return shards.values().stream().mapToInt(ShardReport::reused).sum();
    }

    public int totalSkipped() {
        return shards.values().stream().mapToInt(ShardReport::skipped).sum();
    }

    public int totalFailed() {
        return shards.values().stream().mapToInt(ShardReport::failed).sum();
    }

    public int totalAborted() {
        return shards.values().stream().mapToInt(ShardReport::aborted).sum();
    }

    public int groupsAdmitted() {
        return shards.values().stream().mapToInt(ShardReport::groupsAdmitted).sum();
    }

    public int groupsProcessed() {
        return shards.values().stream().mapToInt(ShardReport::groupsProcessed).sum();
    }

    public int shardsWith(ShardReport.Status status) {
        return (int) shards.values().stream().filter(r -> r.status() == status).count();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt == null ? Instant.now() : finishedAt);
    }

    @Override
    public String toString() {
        return "RunSummary[run=" + runId + ", transform=" + transformName
                + ", shards=" + shards.size()
                + ", committed=" + shardsWith(ShardReport.Status.COMMITTED)
                + ", groups=" + groupsProcessed() + "/" + groupsAdmitted()
                + ", created=" + totalCreated()
                + ", reused=" + totalReused()
                + ", skipped=" + totalSkipped()
                + ", failed=" + totalFailed()
                + (totalAborted() > 0 ? ", aborted=" + totalAborted() : "")
                + (interrupted ? ", interrupted" : "")
                + "]";
    }
}
