package com.phillippitts.dialogaugment.service.scheduling;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import com.phillippitts.dialogaugment.domain.RunSummary;
import com.phillippitts.dialogaugment.domain.ShardReport;
import com.phillippitts.dialogaugment.domain.UnitOutcome;
import com.phillippitts.dialogaugment.domain.WorkUnit;
import com.phillippitts.dialogaugment.exception.CheckpointWriteException;
import com.phillippitts.dialogaugment.service.checkpoint.CheckpointStore;
import com.phillippitts.dialogaugment.service.enumerate.ShardWork;
import com.phillippitts.dialogaugment.service.execution.TransformExecutor;
import com.phillippitts.dialogaugment.service.metrics.PipelineMetrics;
import com.phillippitts.dialogaugment.service.rewrite.DocumentRewriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

/**
 * Feeds work units to the worker pool in batches and turns their outcomes into checkpoint
 * progress.
 *
 * <p>Threading model: {@link #run} executes on one thread (the scheduler thread). Units are
 * submitted through an {@link ExecutorCompletionService}, whose queue is the only channel
 * from workers back to the scheduler. All shard bookkeeping, rewriting and checkpoint
 * commits happen on the scheduler thread.
 *
 * <p>Commit points: every {@code save-interval} unit completions and after every batch.
 * A shard is committed at a commit point once it was fully enumerated (not truncated, not
 * failed to decode) and all its units are terminal. Failed units do not block the commit;
 * they are recorded in the run summary. Units aborted by shutdown do block it: the shard stays
 * out of the checkpoint and is redone by the next run.
 *
 * <p>Cancellation stops intake: the batch in flight is drained and committed, no further
 * batch is submitted. An aborted unit also cancels, since the transform is gone.
 */
@Service
public class BatchScheduler {

    private static final Logger LOG = LogManager.getLogger(BatchScheduler.class);

    static final String MDC_SHARD = "shard";

    private final TransformExecutor executor;
    private final Executor workerPool;
    private final DocumentRewriter rewriter;
    private final CheckpointStore checkpointStore;
    private final PipelineMetrics metrics;
    private final int batchSize;
    private final int saveInterval;

    @Autowired
    public BatchScheduler(TransformExecutor executor,
                          @Qualifier("augmentExecutor") Executor workerPool,
                          DocumentRewriter rewriter,
                          CheckpointStore checkpointStore,
                          PipelineMetrics metrics,
                          PipelineProperties props) {
        this(executor, workerPool, rewriter, checkpointStore, metrics,
                props.getBatchSize(), props.effectiveSaveInterval());
    }

    public BatchScheduler(TransformExecutor executor, Executor workerPool, DocumentRewriter rewriter,
                          CheckpointStore checkpointStore, PipelineMetrics metrics,
                          int batchSize, int saveInterval) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (batchSize < 1 || saveInterval < 1) {
            throw new IllegalArgumentException("batchSize and saveInterval must be >= 1");
        }
        this.batchSize = batchSize;
        this.saveInterval = saveInterval;
    }

    /**
     * Processes every shard the iterator yields, or until cancelled.
     *
     * @throws CheckpointWriteException if progress cannot be persisted
     */
    public void run(Iterator<ShardWork> shards, RunSummary summary, CancellationToken cancel) {
        Map<String, ShardTracker> open = new LinkedHashMap<>();
        List<WorkUnit> batch = new ArrayList<>(batchSize);
        int batches = 0;

        intake:
        while (!cancel.isCancelled() && shards.hasNext()) {
            ShardWork work = shards.next();
            ShardTracker tracker = register(work, summary);
            if (tracker == null) {
                continue;
            }
            open.put(work.shardId(), tracker);
            for (WorkUnit unit : work.units()) {
                batch.add(unit);
                if (batch.size() == batchSize) {
                    runBatch(batch, open, cancel);
                    batches++;
                    batch.clear();
                    if (cancel.isCancelled()) {
                        break intake;
                    }
                }
            }
        }
        if (!batch.isEmpty() && !cancel.isCancelled()) {
            runBatch(batch, open, cancel);
            batches++;
        }
        commitReady(open);

        if (cancel.isCancelled()) {
            summary.markInterrupted();
            LOG.warn("Run cancelled after {} batch(es); {} shard(s) left incomplete", batches, open.size());
        } else {
            LOG.debug("Intake finished after {} batch(es)", batches);
        }
    }

    private ShardTracker register(ShardWork work, RunSummary summary) {
        ShardReport report = summary.shard(work.shardId());
        if (work.isDecodeFailed()) {
            report.setStatus(ShardReport.Status.DECODE_FAILED);
            report.addFailureReason(work.decodeError());
            metrics.incrementDecodeFailures();
            return null;
        }
        report.addSkipped(work.skipped().size());
        report.setGroupsAdmitted(work.groupsAdmitted());
        if (work.truncated()) {
            report.setStatus(ShardReport.Status.TRUNCATED);
        }
        return new ShardTracker(work, report);
    }

    private void runBatch(List<WorkUnit> batch, Map<String, ShardTracker> open, CancellationToken cancel) {
        CompletionService<UnitOutcome> results = new ExecutorCompletionService<>(workerPool);
        Map<Future<UnitOutcome>, WorkUnit> submitted = new HashMap<>();
        for (WorkUnit unit : batch) {
            submitted.put(results.submit(() -> executeWithContext(unit)), unit);
        }
        LOG.debug("Submitted batch of {} unit(s)", batch.size());

        boolean interrupted = false;
        int completed = 0;
        try {
            while (completed < submitted.size()) {
                Future<UnitOutcome> future;
                try {
                    future = results.take();
                } catch (InterruptedException e) {
                    // Drain the batch anyway; stop intake afterwards
                    interrupted = true;
                    cancel.cancel();
                    continue;
                }
                UnitOutcome outcome = outcomeOf(future, submitted.get(future));
                open.get(outcome.unit().shardId()).record(outcome);
                if (outcome.isAborted() && cancel.cancel()) {
                    LOG.warn("Transform stopped mid-run ({}); draining batch and stopping intake",
                            outcome.failureReason());
                }
                completed++;
                if (completed % saveInterval == 0) {
                    commitReady(open);
                }
            }
            commitReady(open);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private UnitOutcome executeWithContext(WorkUnit unit) {
        ThreadContext.put(MDC_SHARD, unit.shardId());
        try {
            return executor.execute(unit);
        } finally {
            ThreadContext.remove(MDC_SHARD);
        }
    }

    private UnitOutcome outcomeOf(Future<UnitOutcome> future, WorkUnit unit) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            LOG.error("Worker crashed on {}", unit.describe(), e.getCause());
            return UnitOutcome.failed(unit, executor.artifactFor(unit), 0, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            // take() returned a completed future, so get() does not block
            Thread.currentThread().interrupt();
            return UnitOutcome.aborted(unit, executor.artifactFor(unit), 0, "interrupted");
        }
    }

    /**
     * Commits every shard whose units all have an outcome. Resolved shards that may not be
     * committed (truncated, or with units aborted by shutdown) are closed without a commit.
     */
    private void commitReady(Map<String, ShardTracker> open) {
        List<ShardTracker> ready = new ArrayList<>();
        Iterator<ShardTracker> it = open.values().iterator();
        while (it.hasNext()) {
            ShardTracker tracker = it.next();
            if (!tracker.isResolved()) {
                continue;
            }
            it.remove();
            if (tracker.hasAbortedUnits()) {
                LOG.warn("Shard {} not committed: {} unit(s) aborted by shutdown", tracker.shardId(),
                        tracker.report().aborted());
                tracker.report().setStatus(ShardReport.Status.INCOMPLETE);
                continue;
            }
            tracker.report().setGroupsProcessed(tracker.work().groupsAdmitted());
            if (!tracker.isReadyToCommit()) {
                LOG.info("Shard {} processed but not committed (truncated)", tracker.shardId());
                continue;
            }
            if (rewriter.isEnabled() && !rewrite(tracker)) {
                continue;
            }
            ready.add(tracker);
        }
        if (ready.isEmpty()) {
            return;
        }
        checkpointStore.commitAll(ready.stream().map(ShardTracker::shardId).toList());
        metrics.incrementShardsCommitted(ready.size());
        ready.forEach(t -> t.report().setStatus(ShardReport.Status.COMMITTED));
    }

    private boolean rewrite(ShardTracker tracker) {
        try {
            rewriter.rewrite(tracker.work(), tracker.outcomes());
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.error("Rewriting shard {} failed; it will be retried next run", tracker.shardId(), e);
            tracker.report().addFailureReason("rewrite failed: " + e.getMessage());
            tracker.report().setStatus(ShardReport.Status.INCOMPLETE);
            return false;
        }
    }
}
