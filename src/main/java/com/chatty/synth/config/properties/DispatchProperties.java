package com.chatty.synth.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Helper fan-out settings. Binds to properties prefixed with "synth.dispatch".
 *
 * @param timeoutMs upper bound on the helper barrier; seats still running at the deadline
 *                  are cancelled and treated as failed
 */
@ConfigurationProperties(prefix = "synth.dispatch")
@Validated
public record DispatchProperties(
        @DefaultValue("60000")
        @Positive(message = "Dispatch timeout must be positive")
        long timeoutMs
) {
    public static final long DEFAULT_TIMEOUT_MS = 60_000L;
}
