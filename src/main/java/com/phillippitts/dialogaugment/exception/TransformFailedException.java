package com.phillippitts.dialogaugment.exception;

/**
 * Terminal failure of a single work unit after its retry budget was exhausted.
 * Never propagates past the scheduler; recorded in the run summary instead.
 */
public class TransformFailedException extends DialogAugmentException {

    private final String contentId;
    private final int attempts;

    public TransformFailedException(String contentId, int attempts, Throwable lastFailure) {
        super("Transform failed for " + contentId + " after " + attempts + " attempt(s): "
                + (lastFailure == null ? "unknown" : lastFailure.getMessage()), lastFailure);
        this.contentId = contentId;
        this.attempts = attempts;
    }

    public String getContentId() {
        return contentId;
    }

    public int getAttempts() {
        return attempts;
    }
}
