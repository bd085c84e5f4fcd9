package com.chatty.synth.service.orchestration;

import com.chatty.synth.domain.ChatReply;
import com.chatty.synth.domain.ChatRequest;

/**
 * Entry point for one chat request.
 *
 * <p>Requests for the {@code synth} seat fan out to the helper seats and merge their output;
 * any other seat is delegated to the single-shot seat process.
 */
public interface SynthOrchestrator {

    /**
     * @param request inbound request
     * @return a {@link com.chatty.synth.domain.SynthesisOutcome} for the synth seat,
     *         a {@link com.chatty.synth.domain.DelegatedReply} otherwise
     * @throws com.chatty.synth.exception.ChattySynthException subclasses on validation,
     *         configuration, helper, synthesis or seat-process failure
     */
    ChatReply reply(ChatRequest request);
}
