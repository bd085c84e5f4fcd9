package com.chatty.synth.service.context;

import com.chatty.synth.domain.UiContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link UiContext} as a deterministic bullet list for the synthesis prompt.
 *
 * <p>Line order is fixed: route, active panel, sidebar, open modals, composer attachment
 * count, composer options menu, composer focus, feature flags, theme, synth mode, notes.
 */
@Component
public class UiContextRenderer {

    /**
     * @return newline-joined bullet lines, or {@code ""} when nothing is known
     */
    public String render(UiContext ui) {
        if (ui == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        if (ui.route() != null) {
            lines.add("- Route: " + ui.route());
        }
        if (ui.activePanel() != null) {
            lines.add("- Active panel: " + ui.activePanel());
        }
        if (ui.sidebarCollapsed() != null) {
            lines.add(ui.sidebarCollapsed() ? "- Sidebar is collapsed" : "- Sidebar is expanded");
        }
        for (String modal : ui.openModals()) {
            lines.add("- Modal \"" + modal + "\" is open");
        }
        if (ui.attachmentCount() != null) {
            lines.add("- Composer has " + formatCount(ui.attachmentCount()) + " attachment(s)");
        }
        if (ui.optionsMenuOpen() != null) {
            lines.add("- Composer options menu is " + (ui.optionsMenuOpen() ? "open" : "closed"));
        }
        if (ui.composerFocused() != null) {
            lines.add(ui.composerFocused() ? "- Composer is focused" : "- Composer is not focused");
        }
        for (Map.Entry<String, Boolean> flag : ui.featureFlags().entrySet()) {
            lines.add("- Feature \"" + flag.getKey() + "\" is " + (flag.getValue() ? "enabled" : "disabled"));
        }
        if (ui.theme() != null) {
            lines.add("- Theme: " + ui.theme());
        }
        if (ui.synthMode() != null) {
            lines.add("- Synth mode: " + ui.synthMode());
        }
        for (String note : ui.notes()) {
            lines.add("- Note: " + note);
        }
        return String.join("\n", lines);
    }

    private static String formatCount(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger) {
            return n.toString();
        }
        double d = n.doubleValue();
        if (Double.isFinite(d) && d == Math.rint(d)) {
            // whole values of any magnitude print as plain digits, never clamped to long range
            return BigDecimal.valueOf(d).toBigInteger().toString();
        }
        return n.toString();
    }
}
