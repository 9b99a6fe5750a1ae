package com.phillippitts.dialogaugment.service.scheduling;

import com.phillippitts.dialogaugment.domain.ShardReport;
import com.phillippitts.dialogaugment.domain.UnitOutcome;
import com.phillippitts.dialogaugment.service.enumerate.ShardWork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Progress of one shard while its units are in flight.
 */
final class ShardTracker {

    private final ShardWork work;
    private final ShardReport report;
    private final List<UnitOutcome> outcomes = new ArrayList<>();
    private int pending;
    private int aborted;

    ShardTracker(ShardWork work, ShardReport report) {
        this.work = work;
        this.report = report;
        this.pending = work.units().size();
    }

    void record(UnitOutcome outcome) {
        outcomes.add(outcome);
        report.record(outcome);
        if (outcome.isAborted()) {
            aborted++;
        }
        pending--;
    }

    /** True once every unit of the shard has an outcome, aborted ones included. */
    boolean isResolved() {
        return pending == 0;
    }

    /** True if shutdown cut at least one unit short; such a shard must be redone. */
    boolean hasAbortedUnits() {
        return aborted > 0;
    }

    boolean isReadyToCommit() {
        return isResolved() && !hasAbortedUnits() && work.isCommittable();
    }

    ShardWork work() {
        return work;
    }

    ShardReport report() {
        return report;
    }

    List<UnitOutcome> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    String shardId() {
        return work.shardId();
    }
}
