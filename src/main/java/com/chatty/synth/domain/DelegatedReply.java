package com.chatty.synth.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reply produced by the single-shot seat process for a non-synth seat, passed through as-is.
 *
 * @param seat normalized seat the process ran
 * @param body JSON object printed by the process, as nested maps and lists
 */
public record DelegatedReply(String seat, Map<String, Object> body) implements ChatReply {
    public DelegatedReply {
        body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }
}
