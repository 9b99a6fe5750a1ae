package com.phillippitts.dialogaugment.exception;

/**
 * Thrown when a turn's utterance fails the payload checks (blank or too long).
 * The unit is skipped and counted in the run summary.
 */
public class ValidationException extends DialogAugmentException {

    private final String reason;

    public ValidationException(String reason) {
        super("Invalid payload: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
