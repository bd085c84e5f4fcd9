package com.chatty.synth.presentation.controller;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /chatty-sync}. Every field is optional at the binding level; the
 * orchestrator rejects a missing prompt.
 *
 * @param prompt user utterance
 * @param seat target seat, {@code synth} when absent
 * @param history prior utterances, either plain strings or objects with a {@code text} or
 *                {@code content} field
 * @param uiContext client UI state document
 * @param timezone client zone id, e.g. {@code Europe/Berlin}
 */
record SyncRequest(
        String prompt,
        String seat,
        List<Object> history,
        Map<String, Object> uiContext,
        String timezone
) {}
