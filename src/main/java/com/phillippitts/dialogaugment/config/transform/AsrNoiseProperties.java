package com.phillippitts.dialogaugment.config.transform;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the ASR noise transform.
 * Binds to properties prefixed with "augment.asr-noise".
 *
 * <p>Example application.properties:
 * <pre>
 * augment.asr-noise.probability=0.4
 * augment.asr-noise.homophones.there=their,they're
 * augment.asr-noise.homophones.to=too,two
 * </pre>
 *
 * @param probability chance that a word with known homophones is replaced
 * @param seed        mixed into the per-payload random seed; change it to get a different variant
 * @param homophones  lower-case word to its replacement candidates
 */
@ConfigurationProperties(prefix = "augment.asr-noise")
@Validated
public record AsrNoiseProperties(
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        @DefaultValue("0.4")
        double probability,

        @DefaultValue("0")
        long seed,

        Map<String, List<String>> homophones
) {
    public AsrNoiseProperties {
        homophones = homophones == null ? Map.of() : Map.copyOf(homophones);
    }
}
