package com.phillippitts.dialogaugment.exception;

/**
 * Retryable transform failure: network error, timeout, rate limit, crashed subprocess.
 */
public class TransientTransformException extends TransformException {

    public TransientTransformException(String message, String transformName) {
        super(message, transformName);
    }

    public TransientTransformException(String message, String transformName, Throwable cause) {
        super(message, transformName, cause);
    }
}
