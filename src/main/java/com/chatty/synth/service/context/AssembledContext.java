package com.chatty.synth.service.context;

import com.chatty.synth.domain.TimeContext;

import java.util.Optional;

/**
 * Rendered context blocks for one request.
 *
 * @param timeContext time snapshot, {@code null} when unavailable
 * @param timeNarrative multi-line temporal block, {@code ""} when no time is known
 * @param timeAwareness one-sentence time note (plus greeting suggestion for greetings), or {@code ""}
 * @param uiSummary bullet list of UI state, or {@code ""}
 */
public record AssembledContext(TimeContext timeContext, String timeNarrative, String timeAwareness, String uiSummary) {

    public static final AssembledContext NONE = new AssembledContext(null, "", "", "");

    public AssembledContext {
        timeNarrative = timeNarrative == null ? "" : timeNarrative;
        timeAwareness = timeAwareness == null ? "" : timeAwareness;
        uiSummary = uiSummary == null ? "" : uiSummary;
    }

    public Optional<TimeContext> time() {
        return Optional.ofNullable(timeContext);
    }
}
