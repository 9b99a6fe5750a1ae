package com.phillippitts.dialogaugment.service.pipeline;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import com.phillippitts.dialogaugment.domain.Checkpoint;
import com.phillippitts.dialogaugment.domain.RunSummary;
import com.phillippitts.dialogaugment.domain.ShardReport;
import com.phillippitts.dialogaugment.exception.CheckpointWriteException;
import com.phillippitts.dialogaugment.exception.InitializationException;
import com.phillippitts.dialogaugment.exception.TransformException;
import com.phillippitts.dialogaugment.exception.TransientTransformException;
import com.phillippitts.dialogaugment.service.checkpoint.CheckpointStore;
import com.phillippitts.dialogaugment.service.enumerate.GroupBudget;
import com.phillippitts.dialogaugment.service.enumerate.ShardWork;
import com.phillippitts.dialogaugment.service.enumerate.WorkUnitEnumerator;
import com.phillippitts.dialogaugment.service.execution.ArtifactStore;
import com.phillippitts.dialogaugment.service.execution.RetryPolicy;
import com.phillippitts.dialogaugment.service.scheduling.BatchScheduler;
import com.phillippitts.dialogaugment.service.scheduling.CancellationToken;
import com.phillippitts.dialogaugment.service.transform.UtteranceTransform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Iterator;
import java.util.Objects;
import java.util.UUID;

/**
 * Owns the lifecycle of one pipeline run.
 *
 * <p>Sequence:
 * <ol>
 *   <li>load the checkpoint</li>
 *   <li>initialize the transform, retrying transient failures with the retry policy</li>
 *   <li>create the group budget and enumerate pending shards</li>
 *   <li>hand the shards to the {@link BatchScheduler}</li>
 *   <li>flush the checkpoint and log the summary</li>
 * </ol>
 *
 * <p>{@link InitializationException} and {@link CheckpointWriteException} are fatal and
 * propagate after a best-effort checkpoint flush. Unit failures only show up in the
 * {@link RunSummary}.
 */
@Service
public class PipelineDriver {

    private static final Logger LOG = LogManager.getLogger(PipelineDriver.class);

    static final String MDC_RUN_ID = "runId";
    private static final int MAX_LOGGED_FAILURES = 10;

    private final PipelineProperties props;
    private final UtteranceTransform transform;
    private final RetryPolicy retryPolicy;
    private final CheckpointStore checkpointStore;
    private final WorkUnitEnumerator enumerator;
    private final BatchScheduler scheduler;
    private final ArtifactStore artifactStore;
    private final RetryTemplate initTemplate;
    private final Clock clock;

    @Autowired
    public PipelineDriver(PipelineProperties props, UtteranceTransform transform, RetryPolicy retryPolicy,
                          CheckpointStore checkpointStore, WorkUnitEnumerator enumerator,
                          BatchScheduler scheduler, ArtifactStore artifactStore) {
        this(props, transform, retryPolicy, checkpointStore, enumerator, scheduler, artifactStore,
                new ThreadWaitSleeper(), Clock.systemUTC());
    }

    public PipelineDriver(PipelineProperties props, UtteranceTransform transform, RetryPolicy retryPolicy,
                          CheckpointStore checkpointStore, WorkUnitEnumerator enumerator,
                          BatchScheduler scheduler, ArtifactStore artifactStore, Sleeper sleeper, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.transform = Objects.requireNonNull(transform, "transform");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.enumerator = Objects.requireNonNull(enumerator, "enumerator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.artifactStore = Objects.requireNonNull(artifactStore, "artifactStore");
        this.initTemplate = retryPolicy.newTemplate(sleeper);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RunSummary run(CancellationToken cancel) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        ThreadContext.put(MDC_RUN_ID, runId);
        RunSummary summary = new RunSummary(runId, transform.getTransformName(), clock.instant());
        LOG.info("Starting run {}: transform={}, input={}, output={}, batchSize={}, maxGroups={} ({})",
                runId, transform.getTransformName(), props.inputPath(), props.outputPath(),
                props.getBatchSize(), props.getMaxGroups(), props.getBudgetScope());
        try {
            Checkpoint checkpoint = checkpointStore.load();
            initializeTransform();
            artifactStore.purgeStaleTempFiles();

            GroupBudget budget = new GroupBudget(props.getMaxGroups(), props.getBudgetScope());
            Iterator<ShardWork> shards = enumerator.enumerate(props.inputPath(), checkpoint.completedShards(), budget);
            scheduler.run(shards, summary, cancel);
            checkpointStore.flush();
            return summary;
        } catch (CheckpointWriteException e) {
            LOG.error("Checkpoint can no longer be written; stopping run {}", runId);
            throw e;
        } catch (RuntimeException e) {
            flushQuietly();
            throw e;
        } finally {
            summary.finish(clock.instant());
            logSummary(summary);
            ThreadContext.remove(MDC_RUN_ID);
        }
    }

    /**
     * Initializes the shared transform, retrying transient failures.
     *
     * @throws InitializationException if the transform cannot be initialized
     */
    void initializeTransform() {
        try {
            initTemplate.execute(context -> {
                initializeOnce(context.getRetryCount() + 1);
                return null;
            });
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitializationException("Interrupted while initializing " + transform.getTransformName(), e);
        } catch (TransientTransformException e) {
            throw new InitializationException("Transform " + transform.getTransformName()
                    + " unavailable after " + retryPolicy.maxAttempts() + " attempt(s)", e);
        } catch (TransformException e) {
            throw new InitializationException("Cannot initialize transform "
                    + transform.getTransformName() + ": " + e.getMessage(), e);
        }
    }

    private void initializeOnce(int attempt) {
        try {
            transform.initialize();
        } catch (TransientTransformException e) {
            if (retryPolicy.hasAttemptsLeft(attempt)) {
                LOG.warn("Transform initialization attempt {} failed; retrying in {} ms: {}",
                        attempt, retryPolicy.delayBefore(attempt + 1).toMillis(), e.getMessage());
            }
            throw e;
        }
    }

    private void flushQuietly() {
        try {
            checkpointStore.flush();
        } catch (CheckpointWriteException e) {
            LOG.error("Best-effort checkpoint flush failed: {}", e.getMessage());
        }
    }

    private void logSummary(RunSummary summary) {
        LOG.info("Run {} finished in {} s: {}", summary.runId(), summary.elapsed().toSeconds(), summary);
        for (ShardReport report : summary.shards()) {
            LOG.info("  {}", report);
            report.failureReasons().stream()
                    .limit(MAX_LOGGED_FAILURES)
                    .forEach(reason -> LOG.warn("    {}", reason));
            int hidden = report.failureReasons().size() - MAX_LOGGED_FAILURES;
            if (hidden > 0) {
                LOG.warn("    ... {} more failure(s)", hidden);
            }
        }
    }
}
