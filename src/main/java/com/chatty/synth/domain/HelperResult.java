package com.chatty.synth.domain;

import java.util.Objects;

/**
 * Non-blank output produced by one helper seat.
 *
 * @param seat helper seat that produced the output
 * @param output trimmed model output
 * @param durationMs wall time of the backend call
 */
public record HelperResult(HelperSeat seat, String output, long durationMs) {
    public HelperResult {
        Objects.requireNonNull(seat, "seat");
        Objects.requireNonNull(output, "output");
        if (output.isBlank()) {
            throw new IllegalArgumentException("output must not be blank");
        }
    }
}
