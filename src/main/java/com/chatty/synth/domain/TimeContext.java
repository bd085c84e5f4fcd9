package com.chatty.synth.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of the user's local time, produced once per request.
 *
 * @param localTime local clock time, e.g. {@code 09:05 AM}
 * @param timeOfDay part-of-day label, e.g. {@code morning}
 * @param dayOfWeek weekday name, e.g. {@code Monday}
 * @param timezone zone id, e.g. {@code Europe/Berlin}
 */
public record TimeContext(String localTime, String timeOfDay, String dayOfWeek, String timezone) {
    public TimeContext {
        Objects.requireNonNull(localTime, "localTime");
        Objects.requireNonNull(timeOfDay, "timeOfDay");
        Objects.requireNonNull(dayOfWeek, "dayOfWeek");
        Objects.requireNonNull(timezone, "timezone");
    }

    /**
     * @return greeting phrase suited to {@link #timeOfDay()}, empty when the label is not a known bucket
     */
    public Optional<String> suggestedGreeting() {
        return TimeOfDay.fromLabel(timeOfDay).map(TimeOfDay::greeting);
    }
}
