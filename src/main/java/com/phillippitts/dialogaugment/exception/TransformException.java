package com.phillippitts.dialogaugment.exception;

/**
 * Common parent of transform failures. Carries the name of the transform that failed.
 *
 * <p>Callers decide retry behavior by subtype: {@link TransientTransformException} is retried,
 * {@link PermanentTransformException} is not.
 */
public abstract class TransformException extends DialogAugmentException {

    private final String transformName;

    protected TransformException(String message, String transformName) {
        super(message + " (transform: " + transformName + ")");
        this.transformName = transformName;
    }

    protected TransformException(String message, String transformName, Throwable cause) {
        super(message + " (transform: " + transformName + ")", cause);
        this.transformName = transformName;
    }

    public String getTransformName() {
        return transformName;
    }
}
