package com.chatty.synth.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Final answer of the synth seat.
 *
 * @param answer synthesis backend output, verbatim
 * @param helperCount number of helper seats that produced output (at least one)
 * @param timeContext time snapshot used for the prompt, {@code null} when unavailable
 */
public record SynthesisOutcome(String answer, int helperCount, TimeContext timeContext) implements ChatReply {
    public SynthesisOutcome {
        Objects.requireNonNull(answer, "answer");
        if (helperCount < 1) {
            throw new IllegalArgumentException("helperCount must be at least 1");
        }
    }

    public Optional<TimeContext> time() {
        return Optional.ofNullable(timeContext);
    }
}
