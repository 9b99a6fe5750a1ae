package com.phillippitts.dialogaugment.service.enumerate;

import com.phillippitts.dialogaugment.exception.ValidationException;

/**
 * Normalizes and bounds utterance payloads.
 */
public final class PayloadValidator {

    private final int maxLength;

    public PayloadValidator(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.maxLength = maxLength;
    }

    /**
     * Returns the trimmed payload.
     *
     * @throws ValidationException if it is missing, empty after trimming, or too long
     */
    public String validate(String raw) {
        if (raw == null) {
            throw new ValidationException("missing utterance");
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("empty utterance");
        }
        if (trimmed.length() > maxLength) {
            throw new ValidationException("utterance too long (" + trimmed.length() + " > " + maxLength + ")");
        }
        return trimmed;
    }
}
