package com.chatty.synth.exception;

/**
 * Base exception for all chatty-synth application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ChattySynthException extends RuntimeException {

    public ChattySynthException(String message) {
        super(message);
    }

    public ChattySynthException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChattySynthException(Throwable cause) {
        super(cause);
    }
}
