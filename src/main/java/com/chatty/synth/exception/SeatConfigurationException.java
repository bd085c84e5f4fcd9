package com.chatty.synth.exception;

/**
 * Thrown when the seat-to-model table cannot be loaded or is incomplete.
 * Raised before any helper call is made.
 */
public class SeatConfigurationException extends ChattySynthException {

    private final String source;

    public SeatConfigurationException(String message, String source) {
        super(message + " (source: " + source + ")");
        this.source = source;
    }

    public SeatConfigurationException(String message, String source, Throwable cause) {
        super(message + " (source: " + source + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
