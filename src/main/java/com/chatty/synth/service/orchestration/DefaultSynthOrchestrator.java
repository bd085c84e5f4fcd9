package com.chatty.synth.service.orchestration;

import com.chatty.synth.config.seat.SeatConfigurationLoader;
import com.chatty.synth.config.seat.SeatModels;
import com.chatty.synth.domain.ChatReply;
import com.chatty.synth.domain.ChatRequest;
import com.chatty.synth.domain.HelperResult;
import com.chatty.synth.domain.Seats;
import com.chatty.synth.domain.SynthesisOutcome;
import com.chatty.synth.domain.Tone;
import com.chatty.synth.exception.InvalidPromptException;
import com.chatty.synth.service.classify.ToneClassifier;
import com.chatty.synth.service.context.AssembledContext;
import com.chatty.synth.service.context.ContextAssembler;
import com.chatty.synth.service.dispatch.HelperDispatcher;
import com.chatty.synth.service.metrics.SynthMetricsPublisher;
import com.chatty.synth.service.orchestration.event.OrchestrationFailedEvent;
import com.chatty.synth.service.orchestration.event.SynthesisCompletedEvent;
import com.chatty.synth.service.seat.SeatProcessRunner;
import com.chatty.synth.service.synthesis.Synthesizer;
import com.chatty.synth.util.LogSanitizer;
import com.chatty.synth.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link SynthOrchestrator}.
 *
 * <p>Synth path: validate, classify tone, assemble time and UI context, resolve seat models,
 * dispatch helpers, aggregate, synthesize. Seat configuration is resolved before any helper
 * call, so a configuration error never reaches the backend.
 *
 * <p>Every failure moves the request's {@link SynthStateMachine} to FAILED, is counted and
 * published as an {@link OrchestrationFailedEvent}, then rethrown unchanged for the web layer.
 */
@Service
public class DefaultSynthOrchestrator implements SynthOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSynthOrchestrator.class);

    private final ToneClassifier classifier;
    private final ContextAssembler contextAssembler;
    private final SeatConfigurationLoader seatConfig;
    private final HelperDispatcher dispatcher;
    private final Synthesizer synthesizer;
    private final SeatProcessRunner seatRunner;
    private final ApplicationEventPublisher publisher;
    private final SynthMetricsPublisher metrics;

    public DefaultSynthOrchestrator(ToneClassifier classifier,
                                    ContextAssembler contextAssembler,
                                    SeatConfigurationLoader seatConfig,
                                    HelperDispatcher dispatcher,
                                    Synthesizer synthesizer,
                                    SeatProcessRunner seatRunner,
                                    ApplicationEventPublisher publisher,
                                    SynthMetricsPublisher metrics) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.contextAssembler = Objects.requireNonNull(contextAssembler, "contextAssembler");
        this.seatConfig = Objects.requireNonNull(seatConfig, "seatConfig");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.seatRunner = Objects.requireNonNull(seatRunner, "seatRunner");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? SynthMetricsPublisher.NOOP : metrics;
    }

    @Override
    public ChatReply reply(ChatRequest request) {
        Objects.requireNonNull(request, "request");
        SynthStateMachine state = new SynthStateMachine(publisher);
        long startTime = System.nanoTime();
        try {
            state.transitionTo(OrchestrationState.VALIDATING);
            String prompt = request.prompt();
            if (prompt == null || prompt.isEmpty()) {
                throw new InvalidPromptException();
            }
            String seat = Seats.normalize(request.seat());
            if (!Seats.isSynth(seat)) {
                ChatReply delegated = seatRunner.runOnce(prompt, seat);
                state.transitionTo(OrchestrationState.DONE);
                return delegated;
            }
            return synthesize(request, prompt, state, startTime);
        } catch (RuntimeException e) {
            OrchestrationState failedIn = state.fail();
            String category = e.getClass().getSimpleName();
            LOG.warn("Request failed in {}: {} ({})", failedIn, e.getMessage(), category);
            metrics.recordRequestFailure(category);
            publisher.publishEvent(new OrchestrationFailedEvent(failedIn, category, e.getMessage(), Instant.now()));
            throw e;
        }
    }

    private SynthesisOutcome synthesize(ChatRequest request, String prompt, SynthStateMachine state, long startTime) {
        LOG.info("Synth request: '{}'", LogSanitizer.preview(prompt));

        state.transitionTo(OrchestrationState.CLASSIFYING);
        Tone tone = classifier.classify(prompt, request.history());
        LOG.debug("Tone classified as {}", tone);

        state.transitionTo(OrchestrationState.CONTEXT);
        AssembledContext context = contextAssembler.assemble(request, tone);

        state.transitionTo(OrchestrationState.DISPATCHING);
        SeatModels models = seatConfig.load();
        List<HelperResult> helpers = dispatcher.dispatch(prompt, models);

        state.transitionTo(OrchestrationState.AGGREGATING);
        LOG.debug("Aggregated {} helper result(s): {}", helpers.size(),
                helpers.stream().map(h -> h.seat().id()).toList());

        state.transitionTo(OrchestrationState.SYNTHESIZING);
        String answer = synthesizer.synthesize(models.synthesisModel(), prompt, tone, context, helpers);

        state.transitionTo(OrchestrationState.DONE);
        long durationMs = TimeUtils.elapsedMillis(startTime);
        publisher.publishEvent(new SynthesisCompletedEvent(helpers.size(), durationMs,
                answer == null ? 0 : answer.length(), Instant.now()));
        LOG.info("Synth request completed in {}ms with {} helper(s)", durationMs, helpers.size());
        return new SynthesisOutcome(answer, helpers.size(), context.timeContext());
    }
}
