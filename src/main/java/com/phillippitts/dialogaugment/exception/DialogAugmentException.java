package com.phillippitts.dialogaugment.exception;

/**
 * Base exception for all dialog-augment application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DialogAugmentException extends RuntimeException {

    public DialogAugmentException(String message) {
        super(message);
    }

    public DialogAugmentException(String message, Throwable cause) {
        super(message, cause);
    }

    public DialogAugmentException(Throwable cause) {
        super(cause);
    }
}
