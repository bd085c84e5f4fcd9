package com.chatty.synth.util;

import java.time.Duration;

/**
 * Timeouts for stream-gobbler threads and subprocess shutdown used by
 * {@link com.chatty.synth.service.seat.CliSeatProcessRunner}.
 */
public final class ProcessTimeouts {

    /** Time allowed for stdout/stderr readers to flush after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Grace period after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Deadline for {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
    }
}
