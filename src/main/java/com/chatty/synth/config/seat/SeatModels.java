package com.chatty.synth.config.seat;

import com.chatty.synth.domain.HelperSeat;
import com.chatty.synth.exception.SeatConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved model tags for one synthesis request: one per helper seat plus the synthesis model.
 *
 * @param helperModels model tag per helper seat; every {@link HelperSeat} is present
 * @param synthesisModel model used for the final merge call
 */
public record SeatModels(Map<HelperSeat, String> helperModels, String synthesisModel) {

    public SeatModels {
        Objects.requireNonNull(helperModels, "helperModels");
        Objects.requireNonNull(synthesisModel, "synthesisModel");
        EnumMap<HelperSeat, String> copy = new EnumMap<>(HelperSeat.class);
        copy.putAll(helperModels);
        for (HelperSeat seat : HelperSeat.values()) {
            if (!copy.containsKey(seat)) {
                throw new IllegalArgumentException("No model for seat " + seat.id());
            }
        }
        helperModels = Collections.unmodifiableMap(copy);
    }

    public String modelFor(HelperSeat seat) {
        return helperModels.get(seat);
    }

    /**
     * Convenience for tests and fixed setups where every seat shares one model.
     */
    public static SeatModels uniform(String model) {
        Map<HelperSeat, String> m = new EnumMap<>(HelperSeat.class);
        for (HelperSeat seat : HelperSeat.values()) {
            m.put(seat, model);
        }
        return new SeatModels(m, model);
    }

    static String requireModel(String value, String seat, String source) {
        if (value == null || value.isBlank()) {
            throw new SeatConfigurationException("No model configured for seat '" + seat + "'", source);
        }
        return value.trim();
    }
}
