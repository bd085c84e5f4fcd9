package com.chatty.synth.service.orchestration.event;

import com.chatty.synth.service.orchestration.OrchestrationState;

import java.time.Instant;

/**
 * Emitted when a synth request aborts.
 *
 * @param failedIn state the request was in when it failed
 * @param errorType simple class name of the failure
 * @param message failure message
 * @param timestamp failure time
 */
public record OrchestrationFailedEvent(
        OrchestrationState failedIn,
        String errorType,
        String message,
        Instant timestamp
) {}
