/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.chatty.synth.exception.ChattySynthException} and are
 * unchecked. They map to HTTP responses in
 * {@code com.chatty.synth.presentation.exception.GlobalExceptionHandler}:
 * <ul>
 *   <li>{@link com.chatty.synth.exception.InvalidPromptException} - 400, missing prompt</li>
 *   <li>{@link com.chatty.synth.exception.AllHelpersFailedException} - 502, no helper seat answered</li>
 *   <li>{@link com.chatty.synth.exception.SynthesisException} - 500, final synthesis call failed</li>
 *   <li>{@link com.chatty.synth.exception.SeatConfigurationException} - 500, seat models unavailable</li>
 *   <li>{@link com.chatty.synth.exception.SeatProcessException} - 502, single-shot seat process failed</li>
 *   <li>{@link com.chatty.synth.exception.InvalidSeatOutputException} - 500, seat process printed non-JSON</li>
 * </ul>
 *
 * <p>{@link com.chatty.synth.exception.BackendException} never reaches the handler directly:
 * helper failures are absorbed by the dispatcher and synthesis failures are rewrapped.
 */
package com.chatty.synth.exception;
