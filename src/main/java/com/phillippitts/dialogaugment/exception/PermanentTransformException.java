package com.phillippitts.dialogaugment.exception;

/**
 * Non-retryable transform failure, e.g. input the backend rejects outright.
 * The unit is marked failed on the first occurrence.
 */
public class PermanentTransformException extends TransformException {

    public PermanentTransformException(String message, String transformName) {
        super(message, transformName);
    }

    public PermanentTransformException(String message, String transformName, Throwable cause) {
        super(message, transformName, cause);
    }
}
