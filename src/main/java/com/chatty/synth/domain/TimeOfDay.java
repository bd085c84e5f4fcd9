package com.chatty.synth.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse part of the day, with the greeting suggested for it.
 */
public enum TimeOfDay {
    LATE_NIGHT("late night", "Good morning"),
    MORNING("morning", "Good morning"),
    AFTERNOON("afternoon", "Good afternoon"),
    EVENING("evening", "Good evening"),
    NIGHT("night", "Good evening");

    private final String label;
    private final String greeting;

    TimeOfDay(String label, String greeting) {
        this.label = label;
        this.greeting = greeting;
    }

    public String label() {
        return label;
    }

    public String greeting() {
        return greeting;
    }

    /**
     * Buckets a 0-23 hour: before 6 late night, before 12 morning, before 17 afternoon,
     * before 21 evening, otherwise night.
     */
    public static TimeOfDay fromHour(int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour out of range: " + hour);
        }
        if (hour < 6) {
            return LATE_NIGHT;
        }
        if (hour < 12) {
            return MORNING;
        }
        if (hour < 17) {
            return AFTERNOON;
        }
        if (hour < 21) {
            return EVENING;
        }
        return NIGHT;
    }

    /**
     * Case-insensitive lookup by label; labels from other time sources may not match any bucket.
     */
    public static Optional<TimeOfDay> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (TimeOfDay t : values()) {
            if (t.label.equals(normalized)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
