package com.chatty.synth.presentation.controller;

import com.chatty.synth.domain.SynthesisOutcome;
import com.chatty.synth.domain.TimeContext;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Successful synth reply: {@code {"answer", "model": "synth", "metadata": {"helpers", "time"?}}}.
 */
record SyncResponse(String answer, String model, Metadata metadata) {

    static final String SYNTH_MODEL = "synth";

    /**
     * @param helpers number of helper seats merged into the answer
     * @param time time snapshot, omitted from JSON when absent
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Metadata(int helpers, TimeContext time) {}

    static SyncResponse from(SynthesisOutcome outcome) {
        return new SyncResponse(outcome.answer(), SYNTH_MODEL,
                new Metadata(outcome.helperCount(), outcome.time().orElse(null)));
    }
}
