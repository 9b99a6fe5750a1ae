package com.phillippitts.dialogaugment.config;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PipelinePropertiesTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    void defaultsAreValid() {
        PipelineProperties props = new PipelineProperties();

        assertThat(validator.validate(props)).isEmpty();
        assertThat(props.getBatchSize()).isEqualTo(32);
        assertThat(props.getMaxPayloadLength()).isEqualTo(500);
        assertThat(props.getBudgetScope()).isEqualTo(PipelineProperties.BudgetScope.GLOBAL);
    }

    @Test
    void checkpointDefaultsIntoOutputDir() {
        PipelineProperties props = new PipelineProperties();
        props.setOutputDir("out");

        assertThat(props.checkpointPath()).isEqualTo(Path.of("out", "checkpoint.json"));

        props.setCheckpointFile("state/progress.json");
        assertThat(props.checkpointPath()).isEqualTo(Path.of("state/progress.json"));
    }

    @Test
    void saveIntervalDerivedFromBatchSize() {
        PipelineProperties props = new PipelineProperties();
        assertThat(props.effectiveSaveInterval()).isEqualTo(3);

        props.setBatchSize(5);
        assertThat(props.effectiveSaveInterval()).isEqualTo(1);

        props.setSaveInterval(7);
        assertThat(props.effectiveSaveInterval()).isEqualTo(7);
    }

    @Test
    void invalidValuesAreRejected() {
        PipelineProperties props = new PipelineProperties();
        props.setBatchSize(0);
        props.setInputDir(" ");

        Set<ConstraintViolation<PipelineProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("batchSize", "inputDir");
    }
}
