package com.chatty.synth.domain;

/**
 * Result of handling a {@link ChatRequest}: either a synthesized answer or a delegated seat reply.
 */
public interface ChatReply {
}
