package com.phillippitts.dialogaugment.service.transform;

import com.phillippitts.dialogaugment.exception.PermanentTransformException;
import com.phillippitts.dialogaugment.exception.TransformClosedException;
import com.phillippitts.dialogaugment.exception.TransformException;
import com.phillippitts.dialogaugment.exception.TransientTransformException;
import jakarta.annotation.PreDestroy;

/**
 * Base class for transforms providing common lifecycle and state management.
 *
 * <p>Template Method: {@link #initialize()} and {@link #close()} are final and synchronized on
 * an internal lock; subclasses supply {@link #doInitialize()} and {@link #doClose()}.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Uninitialized:</b> bean created, backend not touched yet</li>
 *   <li><b>Initialized:</b> {@link #initialize()} completed successfully</li>
 *   <li><b>Closed:</b> {@link #close()} called, transform no longer usable</li>
 * </ol>
 *
 * <p>Both {@link #initialize()} and {@link #close()} are idempotent. A failed initialization
 * leaves the transform uninitialized, so a later call tries again; this is what lets the
 * pipeline retry initialization after a transient failure.
 */
public abstract class AbstractUtteranceTransform implements UtteranceTransform {

    /** Guards {@link #initialized} and {@link #closed}. */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    /**
     * Initializes the backend at most once per process.
     *
     * @throws TransformException if initialization fails
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (closed) {
                throw new TransformClosedException(getTransformName());
            }
            if (initialized) {
                return;
            }
            doInitialize();
            initialized = true;
        }
    }

    /**
     * Transform-specific initialization, called within the lock.
     *
     * <p>Must throw {@link TransientTransformException} for failures worth retrying and
     * {@link PermanentTransformException} otherwise.
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    public final boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Transform-specific cleanup, called within the lock. Should never throw; log instead.
     */
    protected abstract void doClose();

    /**
     * Validates that the transform is initialized and not closed.
     *
     * @throws TransformClosedException if it was closed
     * @throws PermanentTransformException if it was never initialized
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (closed) {
                throw new TransformClosedException(getTransformName());
            }
            if (!initialized) {
                throw new PermanentTransformException(
                        getTransformName() + " transform not initialized",
                        getTransformName()
                );
            }
        }
    }

    /**
     * Wraps unexpected failures with transform context, preserving transform exceptions as-is.
     *
     * <p>Usage:
     * <pre>{@code
     * try {
     *     ...
     * } catch (Exception e) {
     *     throw wrapFailure(e);
     * }
     * }</pre>
     */
    protected final TransformException wrapFailure(Exception exception) {
        if (exception instanceof TransformException te) {
            return te;
        }
        return new TransientTransformException(
                getTransformName() + " failed: " + exception.getMessage(),
                getTransformName(),
                exception
        );
    }
}
