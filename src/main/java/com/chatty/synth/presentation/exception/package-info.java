/**
 * Exception-to-HTTP mapping.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.chatty.synth.exception.InvalidPromptException} → 400 {@code {"error":"Missing prompt"}}</li>
 *   <li>{@link com.chatty.synth.exception.AllHelpersFailedException} → 502 {@code {"error":"Synth helper failure"}}</li>
 *   <li>{@link com.chatty.synth.exception.SynthesisException},
 *       {@link com.chatty.synth.exception.SeatConfigurationException} → 500 with the exception message</li>
 *   <li>{@link com.chatty.synth.exception.SeatProcessException} → 502 with stderr and exit code</li>
 *   <li>{@link com.chatty.synth.exception.InvalidSeatOutputException} → 500 {@code {"error":"Invalid JSON from Chatty"}}</li>
 *   <li>{@code Exception} (catch-all) → 500</li>
 * </ul>
 */
package com.chatty.synth.presentation.exception;
