package com.phillippitts.dialogaugment.service.execution;

import com.phillippitts.dialogaugment.domain.Artifact;
import com.phillippitts.dialogaugment.domain.UnitOutcome;
import com.phillippitts.dialogaugment.domain.WorkUnit;
import com.phillippitts.dialogaugment.exception.PermanentTransformException;
import com.phillippitts.dialogaugment.exception.TransformClosedException;
import com.phillippitts.dialogaugment.exception.TransformExceptionBuilder;
import com.phillippitts.dialogaugment.exception.TransformFailedException;
import com.phillippitts.dialogaugment.exception.TransientTransformException;
import com.phillippitts.dialogaugment.service.identity.ContentIdentityService;
import com.phillippitts.dialogaugment.service.metrics.PipelineMetrics;
import com.phillippitts.dialogaugment.service.transform.UtteranceTransform;
import com.phillippitts.dialogaugment.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the transform for a single work unit.
 *
 * <p>Per unit:
 * <ol>
 *   <li>If the artifact for the unit's content id already exists it is reused and the
 *       transform is not invoked.</li>
 *   <li>Otherwise the shared transform is initialized (once per process) and applied to a
 *       temp file, which is published under the final name on success.</li>
 *   <li>Transient failures are retried through the {@link RetryPolicy}'s template; permanent
 *       and unexpected failures end the unit at once.</li>
 * </ol>
 * Failures never escape {@link #execute(WorkUnit)}; they become a FAILED {@link UnitOutcome}.
 * A unit cut short by shutdown (transform closed, backoff interrupted) becomes ABORTED instead,
 * so its shard is not checkpointed.
 * Thread-safe: called concurrently from worker threads.
 */
@Service
public class TransformExecutor {

    private static final Logger LOG = LogManager.getLogger(TransformExecutor.class);

    private final UtteranceTransform transform;
    private final ContentIdentityService identity;
    private final ArtifactStore store;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;
    private final RetryTemplate retryTemplate;

    @Autowired
    public TransformExecutor(UtteranceTransform transform, ContentIdentityService identity, ArtifactStore store,
                             RetryPolicy retryPolicy, PipelineMetrics metrics) {
        this(transform, identity, store, retryPolicy, metrics, new ThreadWaitSleeper());
    }

    public TransformExecutor(UtteranceTransform transform, ContentIdentityService identity, ArtifactStore store,
                             RetryPolicy retryPolicy, PipelineMetrics metrics, Sleeper sleeper) {
        this.transform = Objects.requireNonNull(transform, "transform");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.store = Objects.requireNonNull(store, "store");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.retryTemplate = retryPolicy.newTemplate(sleeper);
    }

    public UnitOutcome execute(WorkUnit unit) {
        Objects.requireNonNull(unit, "unit");
        Artifact artifact = artifactFor(unit);

        if (store.exists(artifact)) {
            LOG.debug("Reusing {} for {}", artifact.path().getFileName(), unit.describe());
            return finish(UnitOutcome.reused(unit, artifact));
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            retryTemplate.execute(context -> {
                attempts.set(context.getRetryCount() + 1);
                attemptLogged(unit, artifact, attempts.get());
                return null;
            });
            LOG.debug("Created {} for {} (attempt {})", artifact.path().getFileName(), unit.describe(), attempts.get());
            return finish(UnitOutcome.created(unit, artifact, attempts.get()));
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted during backoff for {}", unit.describe());
            return abort(unit, artifact, attempts.get(), "interrupted after " + attempts.get() + " attempt(s)");
        } catch (TransformClosedException e) {
            return abort(unit, artifact, attempts.get(), "transform closed after " + attempts.get() + " attempt(s)");
        } catch (TransientTransformException e) {
            if (transform.isClosed()) {
                return abort(unit, artifact, attempts.get(), "transform closed: " + e.getMessage());
            }
            TransformFailedException exhausted = new TransformFailedException(artifact.contentId(), attempts.get(), e);
            LOG.error(exhausted.getMessage());
            return finish(UnitOutcome.failed(unit, artifact, attempts.get(), exhausted.getMessage()));
        } catch (PermanentTransformException e) {
            if (transform.isClosed()) {
                return abort(unit, artifact, attempts.get(), "transform closed: " + e.getMessage());
            }
            LOG.error("Permanent failure for {}: {}", unit.describe(), e.getMessage());
            return finish(UnitOutcome.failed(unit, artifact, attempts.get(), e.getMessage()));
        } catch (RuntimeException e) {
            if (transform.isClosed()) {
                return abort(unit, artifact, attempts.get(), "transform closed: " + e);
            }
            LOG.error("Unexpected failure for {} (payload='{}')", unit.describe(),
                    LogSanitizer.preview(unit.payload(), 40), e);
            return finish(UnitOutcome.failed(unit, artifact, attempts.get(), e.toString()));
        }
    }

    /**
     * Artifact a unit maps to; does not touch storage.
     */
    public Artifact artifactFor(WorkUnit unit) {
        return store.resolve(identity.contentId(unit), transform.artifactExtension());
    }

    private void attemptLogged(WorkUnit unit, Artifact artifact, int attempt) {
        try {
            attempt(unit, artifact);
        } catch (TransientTransformException e) {
            if (retryPolicy.hasAttemptsLeft(attempt) && !transform.isClosed()) {
                metrics.incrementRetry(transform.getTransformName());
                LOG.warn("Attempt {}/{} for {} failed, retrying in {} ms: {}", attempt,
                        retryPolicy.maxAttempts(), unit.describe(),
                        retryPolicy.delayBefore(attempt + 1).toMillis(), e.getMessage());
            }
            throw e;
        }
    }

    private void attempt(WorkUnit unit, Artifact artifact) {
        transform.initialize();
        Path tmp = null;
        try {
            tmp = store.newTempFile(artifact);
            long start = System.nanoTime();
            transform.apply(unit.payload(), tmp);
            metrics.recordTransformLatency(transform.getTransformName(), System.nanoTime() - start);
            store.publish(tmp, artifact);
            tmp = null;
        } catch (IOException e) {
            throw TransformExceptionBuilder.create("Artifact I/O failed: " + e.getMessage())
                    .transform(transform.getTransformName())
                    .cause(e)
                    .metadata("artifact", artifact.path())
                    .build();
        } finally {
            if (tmp != null) {
                store.discard(tmp);
            }
        }
    }

    private UnitOutcome abort(WorkUnit unit, Artifact artifact, int attempts, String reason) {
        LOG.warn("Abandoning {} during shutdown: {}", unit.describe(), reason);
        return finish(UnitOutcome.aborted(unit, artifact, attempts, reason));
    }

    private UnitOutcome finish(UnitOutcome outcome) {
        metrics.recordOutcome(transform.getTransformName(), outcome.kind());
        return outcome;
    }
}
