package com.chatty.synth.domain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Helper seats consulted on every synthesis request, in declaration order.
 *
 * <p>The declaration order is the order helper output appears in the synthesis prompt,
 * regardless of which backend call finished first.
 */
public enum HelperSeat {
    CODING("coding"),
    CREATIVE("creative"),
    SMALLTALK("smalltalk");

    private static final List<HelperSeat> DISPATCH_ORDER = List.of(values());

    private final String id;

    HelperSeat(String id) {
        this.id = id;
    }

    /**
     * @return lowercase seat identifier used in configuration and requests
     */
    public String id() {
        return id;
    }

    /**
     * @return heading label used in the synthesis prompt, e.g. {@code CODING}
     */
    public String heading() {
        return id.toUpperCase(Locale.ROOT);
    }

    public static List<HelperSeat> dispatchOrder() {
        return DISPATCH_ORDER;
    }

    public static Optional<HelperSeat> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (HelperSeat seat : DISPATCH_ORDER) {
            if (seat.id.equals(normalized)) {
                return Optional.of(seat);
            }
        }
        return Optional.empty();
    }
}
