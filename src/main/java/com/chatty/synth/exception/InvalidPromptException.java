package com.chatty.synth.exception;

/**
 * Thrown when a chat request carries no prompt (absent or empty). Whitespace-only prompts are accepted.
 * Surfaced to clients as HTTP 400 with {@code {"error":"Missing prompt"}}.
 */
public class InvalidPromptException extends ChattySynthException {

    public static final String MISSING_PROMPT = "Missing prompt";

    public InvalidPromptException() {
        super(MISSING_PROMPT);
    }
}
