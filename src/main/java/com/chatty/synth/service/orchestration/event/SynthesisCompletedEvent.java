package com.chatty.synth.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when the merged answer is ready.
 *
 * @param helperCount number of helper seats whose output was merged
 * @param durationMs total request time from validation to answer
 * @param answerChars answer length
 * @param timestamp completion time
 */
public record SynthesisCompletedEvent(
        int helperCount,
        long durationMs,
        int answerChars,
        Instant timestamp
) {}
