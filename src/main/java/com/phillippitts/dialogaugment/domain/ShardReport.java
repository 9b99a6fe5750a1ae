package com.phillippitts.dialogaugment.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-shard counts for the run summary.
 *
 * <p>Mutable while the run is in progress; only the scheduler thread writes to it.
 */
public final class ShardReport {

    /** Final disposition of a shard in this run. */
    public enum Status {
        /** Recorded in the checkpoint. */
        COMMITTED,
        /** Not all units finished (cancelled run, shutdown mid-unit or rewrite failure). */
        INCOMPLETE,
        /** Budget refused one of its groups; left for a later run. */
        TRUNCATED,
        /** Document could not be parsed. */
        DECODE_FAILED
    }

    private final String shardId;
    private int created;
    private int reused;
    private int skipped;
    private int failed;
    private int aborted;
    private int groupsAdmitted;
    private int groupsProcessed;
    private Status status = Status.INCOMPLETE;
    private final List<String> failureReasons = new ArrayList<>();

    public ShardReport(String shardId) {
        this.shardId = Objects.requireNonNull(shardId, "shardId");
    }

    public void record(UnitOutcome outcome) {
        switch (outcome.kind()) {
            case CREATED -> created++;
            case REUSED -> reused++;
            case FAILED -> {
                failed++;
                failureReasons.add(outcome.unit().describe() + ": " + outcome.failureReason());
            }
            case ABORTED -> aborted++;
        }
    }

    public void addSkipped(int count) {
        skipped += count;
    }

    /** Groups the budget admitted when the shard was enumerated. */
    public void setGroupsAdmitted(int groups) {
        this.groupsAdmitted = groups;
    }

    /** Groups whose units all reached a terminal outcome in this run. */
    public void setGroupsProcessed(int groups) {
        this.groupsProcessed = groups;
    }

    public void setStatus(Status status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    /** Adds a shard-level failure, e.g. a decode error. */
    public void addFailureReason(String reason) {
        failureReasons.add(reason);
    }

    public String shardId() {
        return shardId;
    }

    /** Units whose artifact was created or reused. */
    public int succeeded() {
        return created + reused;
    }

    public int created() {
        return created;
    }

    public int reused() {
        return reused;
    }

    public int skipped() {
        return skipped;
    }

    public int failed() {
        return failed;
    }

    /** Units stopped by shutdown; they run again next time. */
    public int aborted() {
        return aborted;
    }

    public int groupsAdmitted() {
        return groupsAdmitted;
    }

    public int groupsProcessed() {
        return groupsProcessed;
    }

    public Status status() {
        return status;
    }

    public List<String> failureReasons() {
        return Collections.unmodifiableList(failureReasons);
    }

    @Override
    public String toString() {
        return shardId + "[" + status + ": created=" + created + ", reused=" + reused + ", skipped=" + skipped
                + ", failed=" + failed + (aborted > 0 ? ", aborted=" + aborted : "") + "]";
    }
}
