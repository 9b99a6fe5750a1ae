package com.phillippitts.dialogaugment.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for transform failures with structured context.
 *
 * <p>Produces a {@link TransientTransformException} by default, or a
 * {@link PermanentTransformException} when {@link #permanent()} is set.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw TransformExceptionBuilder.create("Non-zero exit: 1")
 *         .transform("synthesis")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("binaryPath", binPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 *
 * throw TransformExceptionBuilder.create("Rejected by translation service")
 *         .transform("back-translation")
 *         .permanent()
 *         .metadata("status", 400)
 *         .build();
 * </pre>
 */
public final class TransformExceptionBuilder {

    private final String message;
    private String transformName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private boolean permanent;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TransformExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static TransformExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TransformExceptionBuilder(message);
    }

    public TransformExceptionBuilder transform(String transformName) {
        this.transformName = transformName;
        return this;
    }

    public TransformExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TransformExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TransformExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Marks the failure as non-retryable.
     *
     * @return this builder for chaining
     */
    public TransformExceptionBuilder permanent() {
        this.permanent = true;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TransformExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return transient or permanent transform exception
     */
    public TransformException build() {
        String detailedMessage = buildDetailedMessage();
        String name = transformName != null ? transformName : "unknown";

        if (permanent) {
            return cause != null
                    ? new PermanentTransformException(detailedMessage, name, cause)
                    : new PermanentTransformException(detailedMessage, name);
        }
        return cause != null
                ? new TransientTransformException(detailedMessage, name, cause)
                : new TransientTransformException(detailedMessage, name);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
