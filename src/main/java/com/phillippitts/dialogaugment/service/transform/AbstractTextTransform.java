package com.phillippitts.dialogaugment.service.transform;

import com.phillippitts.dialogaugment.exception.TransformExceptionBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for transforms whose artifact is plain UTF-8 text.
 */
public abstract class AbstractTextTransform extends AbstractUtteranceTransform {

    public static final String TEXT_EXTENSION = "txt";

    @Override
    public final void apply(String payload, Path target) {
        ensureInitialized();
        String output = transformText(payload);
        try {
            Files.writeString(target, output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw TransformExceptionBuilder.create("Failed to write text artifact")
                    .transform(getTransformName())
                    .cause(e)
                    .metadata("target", target)
                    .build();
        }
    }

    /**
     * Produces the transformed text. Never returns null.
     */
    protected abstract String transformText(String payload);

    @Override
    public String artifactExtension() {
        return TEXT_EXTENSION;
    }
}
