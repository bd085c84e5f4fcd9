package com.chatty.synth.presentation.controller;

import com.chatty.synth.domain.ChatReply;
import com.chatty.synth.domain.ChatRequest;
import com.chatty.synth.domain.DelegatedReply;
import com.chatty.synth.domain.SynthesisOutcome;
import com.chatty.synth.domain.UiContext;
import com.chatty.synth.service.orchestration.SynthOrchestrator;
import com.chatty.synth.service.traffic.TrafficEntry;
import com.chatty.synth.service.traffic.TrafficLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synchronous chat endpoint and the recent-traffic diagnostics view.
 *
 * <p>Errors are mapped by {@code GlobalExceptionHandler}.
 */
@RestController
class SynthController {

    private static final Logger LOG = LogManager.getLogger(SynthController.class);
    static final String TIMEZONE_HEADER = "X-Timezone";

    private final SynthOrchestrator orchestrator;
    private final TrafficLog trafficLog;

    SynthController(SynthOrchestrator orchestrator, TrafficLog trafficLog) {
        this.orchestrator = orchestrator;
        this.trafficLog = trafficLog;
    }

    @PostMapping("/chatty-sync")
    ResponseEntity<Object> chattySync(@RequestBody(required = false) SyncRequest body,
                                      @RequestHeader(value = TIMEZONE_HEADER, required = false) String timezoneHeader) {
        ChatRequest request = toChatRequest(body == null ? new SyncRequest(null, null, null, null, null) : body,
                timezoneHeader);
        trafficLog.record(TrafficLog.IN, inboundPayload(request));
        LOG.debug("chatty-sync seat={} historySize={}", request.seat(), request.history().size());

        ChatReply reply = orchestrator.reply(request);
        Object responseBody = responseBody(reply);
        trafficLog.record(TrafficLog.OUT, responseBody);
        return ResponseEntity.ok(responseBody);
    }

    @GetMapping("/last-messages")
    ResponseEntity<Map<String, List<TrafficEntry>>> lastMessages() {
        return ResponseEntity.ok(Map.of("messages", trafficLog.snapshot()));
    }

    static ChatRequest toChatRequest(SyncRequest body, String timezoneHeader) {
        String timezone = body.timezone() != null && !body.timezone().isBlank() ? body.timezone() : timezoneHeader;
        return new ChatRequest(body.prompt(), body.seat(), historyTexts(body.history()),
                UiContext.from(body.uiContext()), timezone);
    }

    static List<String> historyTexts(List<Object> history) {
        if (history == null) {
            return List.of();
        }
        List<String> texts = new ArrayList<>(history.size());
        for (Object item : history) {
            if (item instanceof String s) {
                texts.add(s);
            } else if (item instanceof Map<?, ?> m) {
                Object text = m.get("text") != null ? m.get("text") : m.get("content");
                if (text != null) {
                    texts.add(text.toString());
                }
            }
        }
        return texts;
    }

    private static Map<String, Object> inboundPayload(ChatRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", request.prompt());
        payload.put("seat", request.seat());
        return payload;
    }

    private static Object responseBody(ChatReply reply) {
        if (reply instanceof SynthesisOutcome outcome) {
            return SyncResponse.from(outcome);
        }
        if (reply instanceof DelegatedReply delegated) {
            return delegated.body();
        }
        throw new IllegalStateException("Unsupported reply type: " + reply.getClass().getName());
    }
}
