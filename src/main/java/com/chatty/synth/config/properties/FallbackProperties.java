package com.chatty.synth.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the single-shot seat process used by non-synth seats.
 * Binds to properties prefixed with "synth.fallback".
 *
 * @param cliPath path to the chat CLI executable
 * @param timeoutSeconds maximum run time before the process is destroyed
 * @param maxStdoutBytes stdout accumulation cap
 */
@ConfigurationProperties(prefix = "synth.fallback")
@Validated
public record FallbackProperties(
        @DefaultValue("bin/chatty")
        @NotBlank(message = "CLI path must not be blank")
        String cliPath,

        @DefaultValue("120")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("1048576")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {
}
