package com.phillippitts.dialogaugment.config.transform;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the speech synthesis transform.
 * Binds to properties prefixed with "augment.synthesis".
 *
 * <p>Example application.properties:
 * <pre>
 * augment.synthesis.binary-path=/opt/tts/bin/tts
 * augment.synthesis.model-name=tts_models/en/ljspeech/tacotron2-DDC
 * augment.synthesis.timeout-seconds=120
 * augment.synthesis.use-cuda=false
 * </pre>
 *
 * @param binaryPath     TTS command line binary; a bare name is looked up on the PATH
 * @param modelName      model identifier passed as {@code --model_name}
 * @param timeoutSeconds maximum time for one synthesis call
 * @param useCuda        whether to pass {@code --use_cuda true}
 * @param maxOutputBytes cap on captured stdout/stderr per call
 */
@ConfigurationProperties(prefix = "augment.synthesis")
@Validated
public record SynthesisConfig(
        @NotBlank(message = "Synthesis binary path must not be blank")
        @DefaultValue("tts")
        String binaryPath,

        @NotBlank(message = "Synthesis model name must not be blank")
        @DefaultValue("tts_models/en/ljspeech/tacotron2-DDC")
        String modelName,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("120")
        int timeoutSeconds,

        @DefaultValue("false")
        boolean useCuda,

        @Positive(message = "Max output bytes must be positive")
        @DefaultValue("65536")
        int maxOutputBytes
) {
}
