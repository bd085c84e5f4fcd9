package com.chatty.synth.service.orchestration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one synth request.
 *
 * <pre>
 * INIT → VALIDATING → CLASSIFYING → CONTEXT → DISPATCHING → AGGREGATING → SYNTHESIZING → DONE
 * VALIDATING → DONE (request delegated to a non-synth seat)
 * any non-terminal state → FAILED
 * </pre>
 */
public enum OrchestrationState {
    INIT,
    VALIDATING,
    CLASSIFYING,
    CONTEXT,
    DISPATCHING,
    AGGREGATING,
    SYNTHESIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * @return {@code true} if a request in this state may move to {@code next}
     */
    public boolean canTransitionTo(OrchestrationState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return next == FAILED || successors().contains(next);
    }

    private Set<OrchestrationState> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(VALIDATING);
            case VALIDATING -> EnumSet.of(CLASSIFYING, DONE);
            case CLASSIFYING -> EnumSet.of(CONTEXT);
            case CONTEXT -> EnumSet.of(DISPATCHING);
            case DISPATCHING -> EnumSet.of(AGGREGATING);
            case AGGREGATING -> EnumSet.of(SYNTHESIZING);
            case SYNTHESIZING -> EnumSet.of(DONE);
            case DONE, FAILED -> EnumSet.noneOf(OrchestrationState.class);
        };
    }
}
