package com.chatty.synth.presentation.exception;

import com.chatty.synth.exception.AllHelpersFailedException;
import com.chatty.synth.exception.InvalidPromptException;
import com.chatty.synth.exception.InvalidSeatOutputException;
import com.chatty.synth.exception.SeatConfigurationException;
import com.chatty.synth.exception.SeatProcessException;
import com.chatty.synth.exception.SynthesisException;
import org.json.JSONException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void missingPromptIsBadRequest() {
        ResponseEntity<GlobalExceptionHandler.ErrorBody> response =
                handler.handleMissingPrompt(new InvalidPromptException());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isEqualTo(new GlobalExceptionHandler.ErrorBody("Missing prompt", null));
    }

    @Test
    void allHelpersFailedIsBadGatewayWithGenericMessage() {
        ResponseEntity<GlobalExceptionHandler.ErrorBody> response =
                handler.handleAllHelpersFailed(new AllHelpersFailedException(3));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().error()).isEqualTo(GlobalExceptionHandler.HELPER_FAILURE);
    }

    @Test
    void synthesisFailureReturnsUnderlyingMessage() {
        ResponseEntity<GlobalExceptionHandler.ErrorBody> response = handler.handleSynthesisFailure(
                new SynthesisException("Backend returned HTTP 500 (model: phi3)", null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).isEqualTo("Backend returned HTTP 500 (model: phi3)");
    }

    @Test
    void seatConfigurationErrorIsServerError() {
        ResponseEntity<GlobalExceptionHandler.ErrorBody> response = handler.handleSeatConfiguration(
                new SeatConfigurationException("No model configured for seat 'coding'", "synth.seats"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).contains("No model configured for seat 'coding'");
    }

    @Test
    void seatProcessFailureReturnsStderrAndExitCode() {
        ResponseEntity<GlobalExceptionHandler.ErrorBody> response = handler.handleSeatProcess(
                new SeatProcessException("Non-zero exit: 3", "coding", 3, "model not found"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody()).isEqualTo(new GlobalExceptionHandler.ErrorBody("model not found", 3));
    }

    @Test
    void seatProcessFailureWithoutStderrUsesGenericMessage() {
        ResponseEntity<GlobalExceptionHandler.ErrorBody> response = handler.handleSeatProcess(
                new SeatProcessException("Timeout after 120s", "coding", null, ""));

        assertThat(response.getBody()).isEqualTo(
                new GlobalExceptionHandler.ErrorBody(GlobalExceptionHandler.SEAT_PROCESS_FAILED, null));
    }

    @Test
    void invalidSeatOutputIsServerError() {
        ResponseEntity<GlobalExceptionHandler.ErrorBody> response = handler.handleInvalidSeatOutput(
                new InvalidSeatOutputException(new JSONException("bad")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).isEqualTo("Invalid JSON from Chatty");
    }

    @Test
    void unexpectedErrorDoesNotLeakDetails() {
        ResponseEntity<GlobalExceptionHandler.ErrorBody> response =
                handler.handleUnexpected(new IllegalStateException("/secret/internal/path"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).isEqualTo(GlobalExceptionHandler.INTERNAL_ERROR);
    }
}
