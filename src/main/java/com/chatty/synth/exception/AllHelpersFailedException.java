package com.chatty.synth.exception;

/**
 * Thrown when every helper seat failed or produced blank output, leaving nothing to synthesize.
 */
public class AllHelpersFailedException extends ChattySynthException {

    private final int attempted;

    public AllHelpersFailedException(int attempted) {
        super("All " + attempted + " helper seats failed");
        this.attempted = attempted;
    }

    public int getAttempted() {
        return attempted;
    }
}
