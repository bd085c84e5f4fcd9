package com.chatty.synth.presentation.controller;

import com.chatty.synth.domain.ChatRequest;
import com.chatty.synth.domain.SynthesisOutcome;
import com.chatty.synth.domain.TimeContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SynthControllerTest {

    @Test
    void historyAcceptsStringsAndMessageObjects() {
        List<Object> history = List.of(
                "hello",
                Map.of("text", "how are you?"),
                Map.of("role", "assistant", "content", "great"),
                Map.of("role", "system"),
                42);

        assertThat(SynthController.historyTexts(history)).containsExactly("hello", "how are you?", "great");
        assertThat(SynthController.historyTexts(null)).isEmpty();
    }

    @Test
    void bodyTimezoneWinsOverHeader() {
        SyncRequest body = new SyncRequest("hi", null, null, null, "Asia/Tokyo");

        ChatRequest request = SynthController.toChatRequest(body, "Europe/Berlin");

        assertThat(request.timezone()).isEqualTo("Asia/Tokyo");
    }

    @Test
    void headerTimezoneUsedWhenBodyHasNone() {
        SyncRequest body = new SyncRequest("hi", null, null, null, " ");

        ChatRequest request = SynthController.toChatRequest(body, "Europe/Berlin");

        assertThat(request.timezone()).isEqualTo("Europe/Berlin");
    }

    @Test
    void uiContextDocumentIsTyped() {
        SyncRequest body = new SyncRequest("hi", "synth", null, Map.of("route", "/chat", "theme", "dark"), null);

        ChatRequest request = SynthController.toChatRequest(body, null);

        assertThat(request.uiContext().route()).isEqualTo("/chat");
        assertThat(request.uiContext().theme()).isEqualTo("dark");
    }

    @Test
    void responseCarriesHelperCountAndOptionalTime() {
        TimeContext time = new TimeContext("07:30 PM", "evening", "Friday", "UTC");

        SyncResponse withTime = SyncResponse.from(new SynthesisOutcome("answer", 2, time));
        SyncResponse withoutTime = SyncResponse.from(new SynthesisOutcome("answer", 1, null));

        assertThat(withTime.model()).isEqualTo("synth");
        assertThat(withTime.metadata().helpers()).isEqualTo(2);
        assertThat(withTime.metadata().time()).isEqualTo(time);
        assertThat(withoutTime.metadata().time()).isNull();
    }
}
