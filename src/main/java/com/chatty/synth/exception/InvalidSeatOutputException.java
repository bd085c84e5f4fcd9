package com.chatty.synth.exception;

/**
 * Thrown when the single-shot seat process exits cleanly but its stdout is not a JSON object.
 */
public class InvalidSeatOutputException extends ChattySynthException {

    public static final String INVALID_JSON = "Invalid JSON from Chatty";

    public InvalidSeatOutputException(Throwable cause) {
        super(INVALID_JSON, cause);
    }
}
