package com.chatty.synth.service.synthesis;

import com.chatty.synth.domain.HelperResult;
import com.chatty.synth.domain.HelperSeat;
import com.chatty.synth.domain.Tone;
import com.chatty.synth.exception.BackendException;
import com.chatty.synth.exception.SynthesisException;
import com.chatty.synth.service.context.AssembledContext;
import com.chatty.synth.service.metrics.SynthMetrics;
import com.chatty.synth.service.metrics.SynthMetricsPublisher;
import com.chatty.synth.testutil.RecordingBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynthesizerTest {

    private static final List<HelperResult> HELPERS =
            List.of(new HelperResult(HelperSeat.CREATIVE, "A dragon story.", 5));

    @Test
    void makesOneCallWithSynthesisModelAndReturnsOutputVerbatim() {
        RecordingBackend backend = RecordingBackend.answering("  Merged answer.\n");
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Synthesizer synthesizer = new Synthesizer(backend, new SynthesisPromptBuilder(),
                new SynthMetricsPublisher(new SynthMetrics(registry)));

        String answer = synthesizer.synthesize("phi3:latest", "tell me a story", Tone.GENERAL,
                AssembledContext.NONE, HELPERS);

        assertThat(answer).isEqualTo("  Merged answer.\n");
        assertThat(backend.calls()).singleElement().satisfies(call -> {
            assertThat(call.model()).isEqualTo("phi3:latest");
            assertThat(call.prompt()).contains("Original question: tell me a story");
            assertThat(call.prompt()).contains("## CREATIVE\nA dragon story.");
        });
        assertThat(registry.find("chattysynth.synthesis.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void backendFailureBecomesSynthesisExceptionWithUnderlyingMessage() {
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            throw new BackendException("read timed out", model);
        });
        Synthesizer synthesizer = new Synthesizer(backend, new SynthesisPromptBuilder(), SynthMetricsPublisher.NOOP);

        assertThatThrownBy(() -> synthesizer.synthesize("phi3", "q", Tone.GENERAL, AssembledContext.NONE, HELPERS))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("read timed out")
                .hasCauseInstanceOf(BackendException.class);
    }

    @Test
    void refusesToSynthesizeWithoutHelpers() {
        Synthesizer synthesizer = new Synthesizer(RecordingBackend.answering("x"), new SynthesisPromptBuilder(),
                SynthMetricsPublisher.NOOP);

        assertThatThrownBy(() -> synthesizer.synthesize("phi3", "q", Tone.GENERAL, AssembledContext.NONE, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void untypedBackendErrorAlsoBecomesSynthesisException() {
        RecordingBackend backend = new RecordingBackend((model, prompt) -> {
            throw new IllegalStateException("socket reset");
        });
        Synthesizer synthesizer = new Synthesizer(backend, new SynthesisPromptBuilder(), SynthMetricsPublisher.NOOP);

        assertThatThrownBy(() -> synthesizer.synthesize("phi3", "q", Tone.GENERAL, AssembledContext.NONE, HELPERS))
                .isInstanceOf(SynthesisException.class)
                .hasMessage("socket reset")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
