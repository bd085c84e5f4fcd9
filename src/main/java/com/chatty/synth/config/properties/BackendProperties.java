package com.chatty.synth.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the Ollama-compatible language-model backend.
 * Binds to properties prefixed with "synth.backend".
 *
 * @param baseUrl backend root, e.g. {@code http://localhost:11434}
 * @param connectTimeoutMs TCP connect timeout per call
 * @param readTimeoutMs read timeout per call; bounds how long one seat can hang
 * @param temperature sampling temperature sent with every generate call
 * @param topP nucleus sampling cutoff sent with every generate call
 */
@ConfigurationProperties(prefix = "synth.backend")
@Validated
public record BackendProperties(
        @DefaultValue("http://localhost:11434")
        @NotBlank(message = "Backend base URL must not be blank")
        String baseUrl,

        @DefaultValue("5000")
        @Positive(message = "Connect timeout must be positive")
        int connectTimeoutMs,

        @DefaultValue("30000")
        @Positive(message = "Read timeout must be positive")
        int readTimeoutMs,

        @DefaultValue("0.7")
        @PositiveOrZero(message = "Temperature must not be negative")
        double temperature,

        @DefaultValue("0.9")
        @Positive(message = "top_p must be positive")
        double topP
) {
}
