/**
 * Request orchestration: validation, routing between the synth pipeline and delegated seats,
 * per-request state tracking and lifecycle events.
 */
package com.chatty.synth.service.orchestration;
