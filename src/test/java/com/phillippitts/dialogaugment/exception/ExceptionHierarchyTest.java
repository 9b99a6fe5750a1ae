package com.phillippitts.dialogaugment.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void dialogAugmentExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        DialogAugmentException ex = new DialogAugmentException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allExceptionsAreUnchecked() {
        assertThat(new DecodeException("a.json", "bad")).isInstanceOf(RuntimeException.class);
        assertThat(new ValidationException("empty")).isInstanceOf(DialogAugmentException.class);
        assertThat(new TransientTransformException("x", "t")).isInstanceOf(TransformException.class);
        assertThat(new PermanentTransformException("x", "t")).isInstanceOf(TransformException.class);
        assertThat(new TransformClosedException("t")).isInstanceOf(PermanentTransformException.class);
        assertThat(new InitializationException("x")).isInstanceOf(DialogAugmentException.class);
    }

    @Test
    void decodeExceptionShouldIncludeShardId() {
        DecodeException ex = new DecodeException("dialogues_003.json", "Unterminated string");

        assertThat(ex.getShardId()).isEqualTo("dialogues_003.json");
        assertThat(ex.getMessage()).contains("dialogues_003.json").contains("Unterminated string");
    }

    @Test
    void validationExceptionExposesReason() {
        ValidationException ex = new ValidationException("empty utterance");

        assertThat(ex.getReason()).isEqualTo("empty utterance");
        assertThat(ex.getMessage()).contains("empty utterance");
    }

    @Test
    void transformExceptionShouldIncludeTransformName() {
        TransientTransformException ex = new TransientTransformException("timeout occurred", "synthesis");

        assertThat(ex.getMessage()).contains("timeout occurred").contains("transform: synthesis");
        assertThat(ex.getTransformName()).isEqualTo("synthesis");
    }

    @Test
    void transformFailedExceptionCarriesAttemptsAndLastFailure() {
        TransientTransformException last = new TransientTransformException("HTTP 503", "back-translation");
        TransformFailedException ex = new TransformFailedException("dialogues-003_4_USER_abc", 3, last);

        assertThat(ex.getContentId()).isEqualTo("dialogues-003_4_USER_abc");
        assertThat(ex.getAttempts()).isEqualTo(3);
        assertThat(ex.getCause()).isSameAs(last);
        assertThat(ex.getMessage()).contains("after 3 attempt(s)").contains("HTTP 503");
    }

    @Test
    void checkpointWriteExceptionShouldIncludePath() {
        Path file = Path.of("/tmp/out/checkpoint.json");
        CheckpointWriteException ex = new CheckpointWriteException(file, new IOException("disk full"));

        assertThat(ex.getCheckpointFile()).isEqualTo(file);
        assertThat(ex.getMessage()).contains("checkpoint.json").contains("disk full");
    }

    @Test
    void builderProducesTransientByDefault() {
        TransformException ex = TransformExceptionBuilder.create("Non-zero exit: 1")
                .transform("synthesis")
                .exitCode(1)
                .durationMs(1500)
                .metadata("stderr", "boom")
                .build();

        assertThat(ex).isInstanceOf(TransientTransformException.class);
        assertThat(ex.getMessage())
                .contains("Non-zero exit: 1 (exitCode=1, durationMs=1500, stderr=boom)")
                .contains("transform: synthesis");
    }

    @Test
    void builderProducesPermanentWhenRequested() {
        IOException cause = new IOException("x");
        TransformException ex = TransformExceptionBuilder.create("Rejected")
                .transform("back-translation")
                .permanent()
                .cause(cause)
                .metadata("status", 400)
                .metadata("ignored", null)
                .build();

        assertThat(ex).isInstanceOf(PermanentTransformException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage()).contains("Rejected (status=400)").doesNotContain("ignored");
    }

    @Test
    void builderWithoutTransformUsesUnknown() {
        TransformException ex = TransformExceptionBuilder.create("plain").build();

        assertThat(ex.getTransformName()).isEqualTo("unknown");
        assertThat(ex.getMessage()).startsWith("plain (transform: unknown)");
    }

    @Test
    void builderRejectsEmptyMessage() {
        assertThatThrownBy(() -> TransformExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
