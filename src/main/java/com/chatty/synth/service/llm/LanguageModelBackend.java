package com.chatty.synth.service.llm;

import com.chatty.synth.exception.BackendException;

/**
 * Text-generation backend used by helper seats and the synthesizer.
 *
 * <p>Implementations must be thread-safe; helper seats call {@link #generate} concurrently.
 */
public interface LanguageModelBackend {

    /**
     * Generates a single completion.
     *
     * @param model backend model tag, e.g. {@code phi3:latest}
     * @param prompt full prompt text
     * @return generated text, never {@code null}
     * @throws BackendException on transport errors, timeouts, non-2xx responses or malformed bodies
     */
    String generate(String model, String prompt);
}
