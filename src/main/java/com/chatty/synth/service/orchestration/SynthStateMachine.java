package com.chatty.synth.service.orchestration;

import com.chatty.synth.service.orchestration.event.OrchestrationStateChangedEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State tracker for a single synth request. One instance per request.
 *
 * <p>Transitions follow {@link OrchestrationState#canTransitionTo}; an illegal transition throws
 * {@link IllegalStateException}. Each accepted transition is published as an
 * {@link OrchestrationStateChangedEvent}.
 */
public final class SynthStateMachine {

    private final Lock lock = new ReentrantLock();
    private final ApplicationEventPublisher publisher;
    private OrchestrationState state = OrchestrationState.INIT;

    public SynthStateMachine(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transitionTo(OrchestrationState next) {
        OrchestrationState from;
        lock.lock();
        try {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next);
            }
            from = state;
            state = next;
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(new OrchestrationStateChangedEvent(from, next, Instant.now()));
    }

    /**
     * Moves to {@link OrchestrationState#FAILED} unless already terminal.
     *
     * @return the state the request was in when it failed
     */
    public OrchestrationState fail() {
        OrchestrationState from;
        lock.lock();
        try {
            from = state;
            if (state.isTerminal()) {
                return from;
            }
            state = OrchestrationState.FAILED;
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(new OrchestrationStateChangedEvent(from, OrchestrationState.FAILED, Instant.now()));
        return from;
    }

    public OrchestrationState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }
}
