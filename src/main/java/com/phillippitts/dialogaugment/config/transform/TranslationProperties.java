package com.phillippitts.dialogaugment.config.transform;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Duration;

/**
 * Configuration properties for the back-translation transform.
 * Binds to properties prefixed with "augment.translation".
 *
 * @param baseUrl              LibreTranslate compatible endpoint root
 * @param apiKey               optional API key, sent only when not blank
 * @param sourceLanguage       language of the dataset
 * @param intermediateLanguage pivot language of the round trip
 * @param connectTimeout       HTTP connect timeout
 * @param readTimeout          HTTP read timeout
 * @param requestInterval      minimum spacing between consecutive requests
 * @param outputField          field added to each turn of the rewritten shard
 */
@ConfigurationProperties(prefix = "augment.translation")
@Validated
public record TranslationProperties(
        @NotBlank(message = "Translation base URL must not be blank")
        @DefaultValue("http://localhost:5000")
        String baseUrl,

        @DefaultValue("")
        String apiKey,

        @NotBlank
        @DefaultValue("en")
        String sourceLanguage,

        @NotBlank
        @DefaultValue("zh")
        String intermediateLanguage,

        @NotNull
        @DefaultValue("5s")
        Duration connectTimeout,

        @NotNull
        @DefaultValue("30s")
        Duration readTimeout,

        @NotNull
        @DefaultValue("1s")
        Duration requestInterval,

        @NotBlank
        @DefaultValue("utterance_noisy")
        String outputField
) {
}
