package com.chatty.synth.domain;

import java.util.List;

/**
 * One inbound chat utterance with its conversational context.
 *
 * @param prompt user utterance; validated by the orchestrator, may arrive empty
 * @param seat requested seat, {@code null} meaning {@link Seats#SYNTH}
 * @param history prior utterance texts, oldest first
 * @param uiContext client UI state
 * @param timezone client zone id hint, may be {@code null}
 */
public record ChatRequest(String prompt, String seat, List<String> history, UiContext uiContext, String timezone) {
    public ChatRequest {
        history = history == null ? List.of() : List.copyOf(history);
        uiContext = uiContext == null ? UiContext.EMPTY : uiContext;
    }

    public static ChatRequest of(String prompt) {
        return new ChatRequest(prompt, Seats.SYNTH, List.of(), UiContext.EMPTY, null);
    }
}
