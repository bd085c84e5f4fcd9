package com.chatty.synth.exception;

/**
 * Thrown when the final synthesis call fails after helper aggregation succeeded.
 * The message is the underlying backend message and is returned to the caller verbatim.
 */
public class SynthesisException extends ChattySynthException {

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
