package com.chatty.synth.exception;

/**
 * Thrown when the single-shot seat process fails to start, times out or exits non-zero.
 */
public class SeatProcessException extends ChattySynthException {

    private final String seat;
    private final Integer exitCode;
    private final String stderr;

    public SeatProcessException(String message, String seat, Integer exitCode, String stderr) {
        super(message + " (seat: " + seat + ")");
        this.seat = seat;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public SeatProcessException(String message, String seat, Throwable cause) {
        super(message + " (seat: " + seat + ")", cause);
        this.seat = seat;
        this.exitCode = null;
        this.stderr = null;
    }

    public String getSeat() {
        return seat;
    }

    /**
     * @return process exit code, or {@code null} when the process never exited normally
     */
    public Integer getExitCode() {
        return exitCode;
    }

    /**
     * @return captured stderr, or {@code null} when none was captured
     */
    public String getStderr() {
        return stderr;
    }
}
