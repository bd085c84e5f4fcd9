package com.chatty.synth.service.context;

import com.chatty.synth.domain.ChatRequest;
import com.chatty.synth.domain.TimeContext;
import com.chatty.synth.domain.Tone;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Builds the time and UI context blocks that precede the question in the synthesis prompt.
 * Never blocks on I/O; the only collaborator is the time source.
 */
@Component
public class ContextAssembler {

    private final TimeAwarenessService timeAwareness;
    private final UiContextRenderer uiRenderer;

    public ContextAssembler(TimeAwarenessService timeAwareness, UiContextRenderer uiRenderer) {
        this.timeAwareness = Objects.requireNonNull(timeAwareness, "timeAwareness");
        this.uiRenderer = Objects.requireNonNull(uiRenderer, "uiRenderer");
    }

    /**
     * @param request inbound request
     * @param tone classification; a greeting adds a time-appropriate opening suggestion
     */
    public AssembledContext assemble(ChatRequest request, Tone tone) {
        Objects.requireNonNull(request, "request");
        Optional<TimeContext> time = timeAwareness.resolve(request);
        String ui = uiRenderer.render(request.uiContext());
        return time
                .map(t -> new AssembledContext(t, narrative(t), awareness(t, tone == Tone.GREETING), ui))
                .orElseGet(() -> new AssembledContext(null, "", "", ui));
    }

    static String narrative(TimeContext t) {
        return "Current temporal context:\n"
                + "- Day: " + t.dayOfWeek() + "\n"
                + "- Time: " + t.localTime() + "\n"
                + "- Time of day: " + t.timeOfDay() + "\n"
                + "- Timezone: " + t.timezone();
    }

    static String awareness(TimeContext t, boolean greeting) {
        String sentence = "You are aware that it is currently " + t.timeOfDay()
                + " for the user and can reference the time naturally.";
        if (greeting) {
            Optional<String> opening = t.suggestedGreeting();
            if (opening.isPresent()) {
                sentence += " If it fits, open with \"" + opening.get() + "\".";
            }
        }
        return sentence;
    }
}
