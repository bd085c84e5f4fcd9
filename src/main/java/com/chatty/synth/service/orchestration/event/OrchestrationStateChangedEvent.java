package com.chatty.synth.service.orchestration.event;

import com.chatty.synth.service.orchestration.OrchestrationState;

import java.time.Instant;

/**
 * Emitted on every accepted state transition of a synth request.
 */
public record OrchestrationStateChangedEvent(
        OrchestrationState from,
        OrchestrationState to,
        Instant timestamp
) {}
