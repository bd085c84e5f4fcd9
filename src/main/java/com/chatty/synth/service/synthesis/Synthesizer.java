package com.chatty.synth.service.synthesis;

import com.chatty.synth.domain.HelperResult;
import com.chatty.synth.domain.Tone;
import com.chatty.synth.exception.SynthesisException;
import com.chatty.synth.service.context.AssembledContext;
import com.chatty.synth.service.llm.LanguageModelBackend;
import com.chatty.synth.service.metrics.SynthMetricsPublisher;
import com.chatty.synth.util.LogSanitizer;
import com.chatty.synth.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Merges helper output into one answer with a single call to the synthesis model.
 */
@Service
public class Synthesizer {

    private static final Logger LOG = LogManager.getLogger(Synthesizer.class);

    private final LanguageModelBackend backend;
    private final SynthesisPromptBuilder promptBuilder;
    private final SynthMetricsPublisher metrics;

    public Synthesizer(LanguageModelBackend backend, SynthesisPromptBuilder promptBuilder,
                       SynthMetricsPublisher metrics) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
        this.metrics = metrics == null ? SynthMetricsPublisher.NOOP : metrics;
    }

    /**
     * @param model synthesis model tag
     * @param prompt original user prompt
     * @param tone request tone
     * @param context rendered time and UI blocks
     * @param helpers non-empty helper results in dispatch order
     * @return the synthesis model's output, unmodified
     * @throws SynthesisException if the backend call fails for any reason
     */
    public String synthesize(String model, String prompt, Tone tone, AssembledContext context,
                             List<HelperResult> helpers) {
        if (helpers == null || helpers.isEmpty()) {
            throw new IllegalArgumentException("helpers must not be empty");
        }
        String synthesisPrompt = promptBuilder.build(prompt, tone, context, helpers);
        long t0 = System.nanoTime();
        try {
            String answer = backend.generate(model, synthesisPrompt);
            long nanos = System.nanoTime() - t0;
            metrics.recordSynthesis(nanos);
            LOG.info("Synthesis with {} helper(s) took {}ms: '{}'", helpers.size(),
                    TimeUtils.nanosToMillis(nanos), LogSanitizer.preview(answer));
            return answer;
        } catch (RuntimeException e) {
            // any backend failure, typed or not, surfaces with its own message
            LOG.warn("Synthesis call failed: {}", e.getMessage());
            throw new SynthesisException(e.getMessage(), e);
        }
    }
}
