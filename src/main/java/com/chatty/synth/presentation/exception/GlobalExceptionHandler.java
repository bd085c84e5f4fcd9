package com.chatty.synth.presentation.exception;

import com.chatty.synth.exception.AllHelpersFailedException;
import com.chatty.synth.exception.InvalidPromptException;
import com.chatty.synth.exception.InvalidSeatOutputException;
import com.chatty.synth.exception.SeatConfigurationException;
import com.chatty.synth.exception.SeatProcessException;
import com.chatty.synth.exception.SynthesisException;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps domain exceptions to the {@code {"error": ...}} response contract.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String HELPER_FAILURE = "Synth helper failure";
    static final String SEAT_PROCESS_FAILED = "Chatty failed";
    static final String INTERNAL_ERROR = "Internal server error";

    /**
     * Client error (HTTP 400). An unreadable body carries no prompt either.
     */
    @ExceptionHandler({InvalidPromptException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ErrorBody> handleMissingPrompt(Exception ex) {
        LOG.warn("Rejected request without prompt: {}", ex.getClass().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ErrorBody(InvalidPromptException.MISSING_PROMPT, null));
    }

    /**
     * No helper seat answered (HTTP 502).
     */
    @ExceptionHandler(AllHelpersFailedException.class)
    ResponseEntity<ErrorBody> handleAllHelpersFailed(AllHelpersFailedException ex) {
        LOG.error("All {} helper seats failed", ex.getAttempted());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ErrorBody(HELPER_FAILURE, null));
    }

    @ExceptionHandler(SynthesisException.class)
    ResponseEntity<ErrorBody> handleSynthesisFailure(SynthesisException ex) {
        LOG.error("Synthesis failed: {}", ex.getMessage(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorBody(ex.getMessage(), null));
    }

    @ExceptionHandler(SeatConfigurationException.class)
    ResponseEntity<ErrorBody> handleSeatConfiguration(SeatConfigurationException ex) {
        LOG.error("Seat configuration unusable: source={}", ex.getSource(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorBody(ex.getMessage(), null));
    }

    /**
     * Seat process failed (HTTP 502). The process's stderr is returned when it wrote any.
     */
    @ExceptionHandler(SeatProcessException.class)
    ResponseEntity<ErrorBody> handleSeatProcess(SeatProcessException ex) {
        LOG.error("Seat process failed: seat={}, exitCode={}", ex.getSeat(), ex.getExitCode(), ex);
        String stderr = ex.getStderr();
        String error = stderr == null || stderr.isBlank() ? SEAT_PROCESS_FAILED : stderr;
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ErrorBody(error, ex.getExitCode()));
    }

    @ExceptionHandler(InvalidSeatOutputException.class)
    ResponseEntity<ErrorBody> handleInvalidSeatOutput(InvalidSeatOutputException ex) {
        LOG.error("Seat process printed invalid JSON: {}", ex.getCause() == null ? "" : ex.getCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorBody(InvalidSeatOutputException.INVALID_JSON, null));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ErrorBody> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorBody(INTERNAL_ERROR, null));
    }

    /**
     * Error response body; {@code code} is the seat process exit code when there is one.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ErrorBody(String error, Integer code) {}
}
