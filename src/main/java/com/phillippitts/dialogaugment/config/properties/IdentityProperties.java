package com.phillippitts.dialogaugment.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Content identity settings.
 *
 * @param hashLength number of hex characters of the SHA-256 digest kept in content ids
 */
@ConfigurationProperties(prefix = "augment.identity")
@Validated
public record IdentityProperties(
        @Min(value = 8, message = "Hash length must be at least 8")
        @Max(value = 64, message = "Hash length cannot exceed the SHA-256 hex length")
        @DefaultValue("12")
        int hashLength
) {
}
