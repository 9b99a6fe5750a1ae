package com.phillippitts.dialogaugment.exception;

/**
 * Fatal error raised when the shared transform resource (or the run's durable state)
 * cannot be acquired. Aborts the run with a non-zero exit code.
 */
public class InitializationException extends DialogAugmentException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
