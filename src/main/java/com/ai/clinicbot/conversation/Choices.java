package com.ai.clinicbot.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * Maps a reply to one of the numbered options shown to the patient. Accepts the
 * option number or the option text itself.
 */
public final class Choices {

    public static final int NONE = -1;

    private Choices() {
    }

    public static int pick(String input, List<String> options) {
        String normalized = normalize(input);
        if (normalized.isEmpty() || options.isEmpty()) return NONE;
        if (normalized.matches("\\d{1,3}")) {
            int index = Integer.parseInt(normalized) - 1;
            return index >= 0 && index < options.size() ? index : NONE;
        }
        for (int i = 0; i < options.size(); i++) {
            if (normalize(options.get(i)).equals(normalized)) return i;
        }
        return NONE;
    }

    /** Lowercase, no accents, no surrounding punctuation. */
    public static String normalize(String input) {
        if (input == null) return "";
        String s = StringUtils.stripAccents(input).toLowerCase(Locale.ROOT).trim();
        return StringUtils.normalizeSpace(StringUtils.strip(s, ".!¡¿?")).trim();
    }
}
