package com.chatty.synth.service.classify;

import com.chatty.synth.domain.Tone;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether an utterance is an opening greeting, casual smalltalk, or neither.
 *
 * <p>All methods are pure: no state is kept between calls and identical input always yields
 * identical output. Safe for concurrent use.
 */
@Component
public class ToneClassifier {

    private static final Set<String> GREETINGS = Set.of(
            "hello", "hi", "hey", "yo",
            "good morning", "good afternoon", "good evening",
            "what's up", "howdy", "greetings",
            "sup", "wassup");

    private static final Pattern TECHNICAL = Pattern.compile(
            "bug|error|fix|code|function|api|stack trace|exception|deploy|database|build|script");

    private static final List<Pattern> SMALLTALK_PHRASES = List.of(
            Pattern.compile("how (are|r) (you|ya)"),
            Pattern.compile("how['’]s it going"),
            Pattern.compile("what['’]s up"),
            Pattern.compile("how are things"),
            Pattern.compile("how are you feeling"),
            Pattern.compile("how do you feel"),
            Pattern.compile("how['’]s your (day|morning|afternoon|evening)"),
            Pattern.compile("what are you up to"),
            Pattern.compile("how['’]s everything"));

    private static final Pattern SECOND_PERSON = Pattern.compile("\\b(you|your)\\b");
    private static final Pattern SENTIMENT_VERB = Pattern.compile("\\b(feel|doing|feeling|going)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final int SMALLTALK_MAX_WORDS = 24;

    /**
     * @return true iff the whole trimmed, lowercased text is one of the short greeting phrases
     */
    public boolean isGreeting(String text) {
        if (text == null) {
            return false;
        }
        return GREETINGS.contains(normalize(text));
    }

    /**
     * Smalltalk check, evaluated in order:
     * <ol>
     *   <li>any technical keyword: never smalltalk</li>
     *   <li>an explicit check-in phrase: smalltalk</li>
     *   <li>otherwise: at most {@value #SMALLTALK_MAX_WORDS} words, addressed to the assistant
     *       ("you"/"your") and asking how it feels or is doing</li>
     * </ol>
     */
    public boolean isSmalltalk(String text) {
        if (text == null) {
            return false;
        }
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return false;
        }
        if (TECHNICAL.matcher(normalized).find()) {
            return false;
        }
        for (Pattern phrase : SMALLTALK_PHRASES) {
            if (phrase.matcher(normalized).find()) {
                return true;
            }
        }
        int wordCount = WHITESPACE.split(normalized).length;
        return wordCount <= SMALLTALK_MAX_WORDS
                && SECOND_PERSON.matcher(normalized).find()
                && SENTIMENT_VERB.matcher(normalized).find();
    }

    /**
     * Combines both checks for one request. A greeting only counts as such when the
     * conversation has no history yet; a greeting after that falls through to the smalltalk check.
     *
     * @param prompt current utterance
     * @param history prior utterances, empty for a new conversation
     * @return the single tone for this request
     */
    public Tone classify(String prompt, List<String> history) {
        boolean conversationStarted = history != null && !history.isEmpty();
        if (!conversationStarted && isGreeting(prompt)) {
            return Tone.GREETING;
        }
        if (isSmalltalk(prompt)) {
            return Tone.SMALLTALK;
        }
        return Tone.GENERAL;
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
