package com.chatty.synth.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the client's UI state document.
 *
 * <p>Every member is optional ({@code null} or empty when absent). {@link #from(Map)} reads the
 * loosely-typed document a client sends, keeps recognized keys whose value has the expected
 * shape, and ignores everything else. Map members preserve document key order.
 *
 * @param route current client route, e.g. {@code /chat}
 * @param activePanel name of the focused panel
 * @param sidebarCollapsed {@code sidebar.collapsed}
 * @param openModals names of modals whose value is truthy, in document order
 * @param attachmentCount {@code composer.attachmentCount}
 * @param optionsMenuOpen {@code composer.optionsMenuOpen}
 * @param composerFocused {@code composer.focused}
 * @param featureFlags flag name to enabled state, in document order
 * @param theme UI theme name
 * @param synthMode synth-mode label shown to the user
 * @param notes free-form notes, trimmed, blanks removed
 */
public record UiContext(
        String route,
        String activePanel,
        Boolean sidebarCollapsed,
        List<String> openModals,
        Number attachmentCount,
        Boolean optionsMenuOpen,
        Boolean composerFocused,
        Map<String, Boolean> featureFlags,
        String theme,
        String synthMode,
        List<String> notes
) {

    public static final UiContext EMPTY = new UiContext(null, null, null, List.of(), null, null, null,
            Map.of(), null, null, List.of());

    public UiContext {
        openModals = openModals == null ? List.of() : List.copyOf(openModals);
        featureFlags = featureFlags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(featureFlags));
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    /**
     * Reads a client UI document. {@code null} yields {@link #EMPTY}.
     *
     * @param doc decoded JSON object (nested maps, lists, strings, numbers, booleans)
     * @return typed context with wrong-shaped and unknown entries dropped
     */
    public static UiContext from(Map<String, ?> doc) {
        if (doc == null || doc.isEmpty()) {
            return EMPTY;
        }
        Map<String, ?> sidebar = asMap(doc.get("sidebar"));
        Map<String, ?> composer = asMap(doc.get("composer"));

        List<String> modals = new ArrayList<>();
        Map<String, ?> modalDoc = asMap(doc.get("modals"));
        if (modalDoc != null) {
            modalDoc.forEach((name, value) -> {
                if (isTruthy(value)) {
                    modals.add(name);
                }
            });
        }

        Map<String, Boolean> flags = new LinkedHashMap<>();
        Map<String, ?> flagDoc = asMap(doc.get("featureFlags"));
        if (flagDoc != null) {
            flagDoc.forEach((name, value) -> flags.put(name, isTruthy(value)));
        }

        List<String> notes = new ArrayList<>();
        if (doc.get("notes") instanceof List<?> rawNotes) {
            for (Object note : rawNotes) {
                if (note instanceof String s && !s.isBlank()) {
                    notes.add(s.trim());
                }
            }
        }

        return new UiContext(
                asText(doc.get("route")),
                asText(doc.get("activePanel")),
                sidebar == null ? null : asBoolean(sidebar.get("collapsed")),
                modals,
                composer == null ? null : asNumber(composer.get("attachmentCount")),
                composer == null ? null : asBoolean(composer.get("optionsMenuOpen")),
                composer == null ? null : asBoolean(composer.get("focused")),
                flags,
                asText(doc.get("theme")),
                asText(doc.get("synthMode")),
                notes
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asMap(Object value) {
        return value instanceof Map<?, ?> m ? (Map<String, ?>) m : null;
    }

    private static String asText(Object value) {
        return value instanceof String s && !s.isBlank() ? s.trim() : null;
    }

    private static Boolean asBoolean(Object value) {
        return value instanceof Boolean b ? b : null;
    }

    private static Number asNumber(Object value) {
        return value instanceof Number n ? n : null;
    }

    // JSON truthiness: false, null, 0, NaN and "" are falsy; objects and arrays are truthy
    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }
}
