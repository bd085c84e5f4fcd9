package com.chatty.synth.exception;

/**
 * Thrown when a language-model backend call fails.
 * This covers transport errors, timeouts, non-2xx responses and malformed bodies alike.
 */
public class BackendException extends ChattySynthException {

    private final String model;

    public BackendException(String message, String model) {
        super(message + " (model: " + model + ")");
        this.model = model;
    }

    public BackendException(String message, String model, Throwable cause) {
        super(message + " (model: " + model + ")", cause);
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
