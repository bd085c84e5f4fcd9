package com.chatty.synth.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a helper seat produced no result. The request continues with the remaining seats.
 *
 * @param seat helper seat id
 * @param model backend model the seat used
 * @param reason failure category: backend_error, blank_output, timeout or unexpected_error
 * @param message error detail, may be {@code null}
 * @param timestamp when the failure was recorded
 */
public record HelperFailedEvent(
        String seat,
        String model,
        String reason,
        String message,
        Instant timestamp
) {}
