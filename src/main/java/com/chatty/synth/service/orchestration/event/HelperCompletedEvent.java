package com.chatty.synth.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a helper seat produced usable output.
 *
 * @param seat helper seat id
 * @param model backend model the seat used
 * @param durationMs wall time of the backend call
 * @param outputChars length of the trimmed output
 * @param timestamp when the result was collected
 */
public record HelperCompletedEvent(
        String seat,
        String model,
        long durationMs,
        int outputChars,
        Instant timestamp
) {}
