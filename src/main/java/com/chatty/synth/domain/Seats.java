package com.chatty.synth.domain;

import java.util.Locale;

/**
 * Seat identifiers that are not helper seats, plus seat-id normalization.
 *
 * <p>Helper seats are modelled by {@link HelperSeat}; {@code synth} names the orchestrator itself.
 */
public final class Seats {

    /** The orchestrating seat: fan out to helpers, then synthesize. */
    public static final String SYNTH = "synth";

    private Seats() {
    }

    /**
     * Trims and lowercases a seat id; absent or blank ids become {@link #SYNTH}.
     */
    public static String normalize(String seat) {
        if (seat == null || seat.isBlank()) {
            return SYNTH;
        }
        return seat.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isSynth(String seat) {
        return SYNTH.equals(normalize(seat));
    }
}
