package com.chatty.synth.domain;

/**
 * Conversational tone of one utterance, as decided by the classifier.
 * Exactly one tone applies per request.
 */
public enum Tone {
    /** Opening greeting on an empty conversation. */
    GREETING,
    /** Personal check-in or casual chat that is not a technical question. */
    SMALLTALK,
    GENERAL
}
