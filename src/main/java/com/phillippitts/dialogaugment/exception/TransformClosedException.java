package com.phillippitts.dialogaugment.exception;

/**
 * Raised when a transform is used after it was closed, typically because the application is
 * shutting down. The unit did not fail on its own merits and must be retried by a later run.
 */
public class TransformClosedException extends PermanentTransformException {

    public TransformClosedException(String transformName) {
        super("Transform already closed", transformName);
    }
}
