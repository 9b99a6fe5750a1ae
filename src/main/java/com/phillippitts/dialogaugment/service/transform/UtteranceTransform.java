package com.phillippitts.dialogaugment.service.transform;

import com.phillippitts.dialogaugment.exception.PermanentTransformException;
import com.phillippitts.dialogaugment.exception.TransientTransformException;

import java.nio.file.Path;
import java.util.Map;

/**
 * An expensive, failure-prone transformation applied to one utterance.
 *
 * <p>Implementations are shared by all worker threads. {@link #apply(String, Path)} must be
 * safe to call concurrently once {@link #initialize()} has completed.
 *
 * <p>Failures are reported through the transform exception hierarchy:
 * {@link TransientTransformException} when a retry may succeed (timeouts, rate limits,
 * unavailable backends) and {@link PermanentTransformException} when it cannot.
 *
 * @see AbstractUtteranceTransform
 */
public interface UtteranceTransform extends AutoCloseable {

    /** How a text transform's output is written back into the rewritten shard document. */
    enum RewriteMode {
        /** Output is a binary artifact; shard documents are not rewritten. */
        NONE,
        /** Output is stored in an additional field of each turn. */
        ADD_FIELD,
        /** Output replaces the original utterance. */
        REPLACE
    }

    /**
     * Prepares the backend (validates binaries, checks services). Idempotent.
     *
     * @throws TransientTransformException if the backend is temporarily unavailable
     * @throws PermanentTransformException if the backend can never become available
     */
    void initialize();

    /**
     * Transforms the payload and writes the result to {@code target}.
     *
     * <p>The target is a temporary file; the caller publishes it under its final name
     * only after this method returns normally.
     *
     * @param payload validated utterance text
     * @param target  file to write the artifact to
     */
    void apply(String payload, Path target);

    /** Short identifier used in configuration, logs and metrics, e.g. {@code synthesis}. */
    String getTransformName();

    /** File extension of produced artifacts, without the dot. */
    String artifactExtension();

    /**
     * Parameters that influence the output. They are part of the content hash, so changing
     * any of them produces new artifacts instead of reusing stale ones.
     */
    Map<String, String> parameters();

    default RewriteMode rewriteMode() {
        return RewriteMode.NONE;
    }

    /** Turn field written by {@link RewriteMode#ADD_FIELD} or {@link RewriteMode#REPLACE}. */
    default String rewriteField() {
        return "utterance";
    }

    boolean isHealthy();

    /** True once {@link #close()} was called; a closed transform cannot be used again. */
    boolean isClosed();

    @Override
    void close();
}
