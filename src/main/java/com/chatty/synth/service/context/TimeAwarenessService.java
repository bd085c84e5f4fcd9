package com.chatty.synth.service.context;

import com.chatty.synth.domain.ChatRequest;
import com.chatty.synth.domain.TimeContext;

import java.util.Optional;

/**
 * Source of the user's local time for a request.
 *
 * <p>An empty result is a normal outcome (time awareness disabled or unavailable), never an error.
 */
public interface TimeAwarenessService {

    /**
     * @param request inbound request; its {@code timezone} hint may be used to pick the zone
     * @return time snapshot, or empty when none can be produced
     */
    Optional<TimeContext> resolve(ChatRequest request);
}
