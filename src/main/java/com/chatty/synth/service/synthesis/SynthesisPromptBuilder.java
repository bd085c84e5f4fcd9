package com.chatty.synth.service.synthesis;

import com.chatty.synth.domain.HelperResult;
import com.chatty.synth.domain.Tone;
import com.chatty.synth.service.context.AssembledContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the merge prompt sent to the synthesis model.
 *
 * <p>Block order: directive header, time narrative, time awareness sentence, original question,
 * interface context, tone note, expert insights, merge instruction with closing line. Empty
 * blocks are skipped and the rest are joined by a blank line.
 */
@Component
public class SynthesisPromptBuilder {

    static final String HEADER = """
            You are Chatty, a fluid conversational AI that naturally synthesizes insights from specialized models.

            FOUNDATIONAL CALIBRATION - FLUID CONVERSATION:
            - Be naturally conversational, not robotic or overly formal.
            - Maintain context awareness and conversation flow.
            - Don't overwhelm with excessive detail unless specifically requested.
            - Be direct and authentic - skip corporate padding.
            - Focus on genuine helpfulness over protective disclaimers.""";

    static final String GREETING_NOTE =
            "NOTE: Simple greeting detected. Respond naturally and briefly - be friendly without overwhelming detail.";
    static final String SMALLTALK_NOTE =
            "NOTE: Casual small talk detected. Keep the reply relaxed and personal rather than instructional.";

    static final String MERGE_INSTRUCTION = "Synthesize these insights into a natural, helpful response. "
            + "Be conversational and maintain context flow. Don't mention the expert analysis process "
            + "unless specifically asked about your capabilities.";

    static final String CLOSING_GREETING = "Keep it brief and friendly.";
    static final String CLOSING_SMALLTALK = "Stay brief, warm, and human-like.";
    static final String CLOSING_GENERAL = "Be comprehensive but not overwhelming.";

    /**
     * @param prompt original user prompt
     * @param tone request tone
     * @param context rendered time and UI blocks
     * @param helpers non-empty helper results in dispatch order
     */
    public String build(String prompt, Tone tone, AssembledContext context, List<HelperResult> helpers) {
        Objects.requireNonNull(tone, "tone");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(helpers, "helpers");

        List<String> blocks = new ArrayList<>();
        blocks.add(HEADER);
        addIfPresent(blocks, context.timeNarrative());
        addIfPresent(blocks, context.timeAwareness());
        blocks.add("Original question: " + (prompt == null ? "" : prompt));
        if (!context.uiSummary().isBlank()) {
            blocks.add("Interface context:\n" + context.uiSummary());
        }
        addIfPresent(blocks, toneNote(tone));
        blocks.add("Expert insights:\n" + insights(helpers));
        blocks.add(MERGE_INSTRUCTION);
        blocks.add(closing(tone));
        return String.join("\n\n", blocks);
    }

    static String insights(List<HelperResult> helpers) {
        List<String> sections = new ArrayList<>(helpers.size());
        for (HelperResult r : helpers) {
            sections.add("## " + r.seat().heading() + "\n" + r.output());
        }
        return String.join("\n\n", sections);
    }

    static String toneNote(Tone tone) {
        if (tone == Tone.GREETING) {
            return GREETING_NOTE;
        }
        return tone == Tone.SMALLTALK ? SMALLTALK_NOTE : "";
    }

    static String closing(Tone tone) {
        if (tone == Tone.GREETING) {
            return CLOSING_GREETING;
        }
        return tone == Tone.SMALLTALK ? CLOSING_SMALLTALK : CLOSING_GENERAL;
    }

    private static void addIfPresent(List<String> blocks, String block) {
        if (block != null && !block.isBlank()) {
            blocks.add(block);
        }
    }
}
