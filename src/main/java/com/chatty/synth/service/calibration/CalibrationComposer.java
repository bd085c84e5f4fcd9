package com.chatty.synth.service.calibration;

import com.chatty.synth.domain.HelperSeat;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Composes the full instruction text sent to a helper seat: the seat's calibration block
 * followed by the literal user prompt.
 *
 * <p>Pure and free of I/O. Seat ids outside the helper table pass the prompt through unchanged.
 */
@Component
public class CalibrationComposer {

    /**
     * @param seatId seat identifier, case-insensitive
     * @param prompt raw user prompt
     * @return calibrated prompt, or {@code prompt} itself for unknown seats
     */
    public String compose(String seatId, String prompt) {
        Objects.requireNonNull(prompt, "prompt");
        return HelperSeat.fromId(seatId)
                .map(seat -> compose(seat, prompt))
                .orElse(prompt);
    }

    public String compose(HelperSeat seat, String prompt) {
        Objects.requireNonNull(seat, "seat");
        Objects.requireNonNull(prompt, "prompt");
        return CalibrationTemplate.preamble(seat) + CalibrationTemplate.REQUEST_LABEL + prompt;
    }
}
