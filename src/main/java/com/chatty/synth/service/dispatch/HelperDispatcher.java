package com.chatty.synth.service.dispatch;

import com.chatty.synth.config.seat.SeatModels;
import com.chatty.synth.domain.HelperResult;
import com.chatty.synth.exception.AllHelpersFailedException;

import java.util.List;

/**
 * Consults every helper seat concurrently with the same user prompt.
 * Implementations must be hermetic-test friendly.
 */
public interface HelperDispatcher {

    /**
     * Runs all helper seats and waits for them to settle.
     *
     * @param prompt raw user prompt; each seat adds its own calibration preamble
     * @param models model tag per helper seat
     * @return successful results in {@link com.chatty.synth.domain.HelperSeat#dispatchOrder()} order,
     *         never empty
     * @throws AllHelpersFailedException when no seat produced output
     */
    List<HelperResult> dispatch(String prompt, SeatModels models);
}
