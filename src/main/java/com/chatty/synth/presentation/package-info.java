/**
 * Presentation layer: REST controllers and exception handling.
 *
 * <p>Controllers are thin adapters over {@link com.chatty.synth.service.orchestration.SynthOrchestrator};
 * domain exceptions are translated to HTTP responses in one place.
 */
package com.chatty.synth.presentation;
