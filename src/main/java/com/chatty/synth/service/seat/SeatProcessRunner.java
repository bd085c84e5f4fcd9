package com.chatty.synth.service.seat;

import com.chatty.synth.domain.DelegatedReply;
import com.chatty.synth.exception.InvalidSeatOutputException;
import com.chatty.synth.exception.SeatProcessException;

/**
 * Answers a prompt for a single non-synth seat by running the chat CLI once.
 */
public interface SeatProcessRunner {

    /**
     * @param prompt user prompt
     * @param seat normalized seat id
     * @return the JSON object the process printed
     * @throws SeatProcessException if the process cannot start, times out or exits non-zero
     * @throws InvalidSeatOutputException if stdout is not a JSON object
     */
    DelegatedReply runOnce(String prompt, String seat);
}
