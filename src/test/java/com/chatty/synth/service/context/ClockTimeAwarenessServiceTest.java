package com.chatty.synth.service.context;

import com.chatty.synth.config.properties.TimeProperties;
import com.chatty.synth.domain.ChatRequest;
import com.chatty.synth.domain.TimeContext;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClockTimeAwarenessServiceTest {

    // Monday 2024-01-15 08:05 UTC
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T08:05:00Z"), ZoneId.of("UTC"));

    private static ChatRequest withZone(String zone) {
        return new ChatRequest("hi", null, List.of(), null, zone);
    }

    @Test
    void usesClockZoneWhenNothingElseIsKnown() {
        ClockTimeAwarenessService svc = new ClockTimeAwarenessService(CLOCK, new TimeProperties(true, ""));

        TimeContext ctx = svc.resolve(withZone(null)).orElseThrow();

        assertThat(ctx.localTime()).isEqualTo("08:05 AM");
        assertThat(ctx.timeOfDay()).isEqualTo("morning");
        assertThat(ctx.dayOfWeek()).isEqualTo("Monday");
        assertThat(ctx.timezone()).isEqualTo("UTC");
    }

    @Test
    void requestZoneWins() {
        ClockTimeAwarenessService svc = new ClockTimeAwarenessService(CLOCK,
                new TimeProperties(true, "America/New_York"));

        TimeContext ctx = svc.resolve(withZone("Asia/Tokyo")).orElseThrow();

        assertThat(ctx.localTime()).isEqualTo("05:05 PM");
        assertThat(ctx.timeOfDay()).isEqualTo("evening");
        assertThat(ctx.timezone()).isEqualTo("Asia/Tokyo");
    }

    @Test
    void invalidRequestZoneFallsBackToConfiguredDefault() {
        ClockTimeAwarenessService svc = new ClockTimeAwarenessService(CLOCK,
                new TimeProperties(true, "America/New_York"));

        TimeContext ctx = svc.resolve(withZone("Mars/Olympus_Mons")).orElseThrow();

        assertThat(ctx.localTime()).isEqualTo("03:05 AM");
        assertThat(ctx.timeOfDay()).isEqualTo("late night");
        assertThat(ctx.suggestedGreeting()).contains("Good morning");
        assertThat(ctx.timezone()).isEqualTo("America/New_York");
    }

    @Test
    void dayFollowsTheUsersZone() {
        ClockTimeAwarenessService svc = new ClockTimeAwarenessService(CLOCK, new TimeProperties(true, ""));

        TimeContext ctx = svc.resolve(withZone("Pacific/Honolulu")).orElseThrow();

        assertThat(ctx.dayOfWeek()).isEqualTo("Sunday");
        assertThat(ctx.localTime()).isEqualTo("10:05 PM");
        assertThat(ctx.timeOfDay()).isEqualTo("night");
    }

    @Test
    void disabledYieldsEmpty() {
        ClockTimeAwarenessService svc = new ClockTimeAwarenessService(CLOCK, new TimeProperties(false, ""));

        assertThat(svc.resolve(withZone("UTC"))).isEmpty();
    }
}
