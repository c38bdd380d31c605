package com.passpattern.generator.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Swaps reserved pattern characters for sentinel tokens and back.
 *
 * <p>Backslash escapes in a raw pattern ({@code \{ \} \[ \] \( \) \+ \| \\}) are replaced before any
 * structural parsing so the resolver never sees them as syntax. Freshly generated values go through
 * {@link #escapeValue(String)} so that, for example, a {@code +} produced by a modifier is not
 * mistaken for a modifier separator further along the pattern.
 */
public class PatternEscaper {

    private static final Map<String, String> ESCAPE_SEQUENCES = new LinkedHashMap<>();
    private static final Map<String, String> RAW_CHARACTERS = new LinkedHashMap<>();
    private static final Map<String, String> SENTINELS = new LinkedHashMap<>();

    static {
        register("\\", "#sla#");
        register("+", "#pls#");
        register("{", "#lbr#");
        register("}", "#rbr#");
        register("[", "#lba#");
        register("]", "#rba#");
        register("(", "#lpa#");
        register(")", "#rpa#");
        register("|", "#pip#");
    }

    private static void register(String character, String sentinel) {
        ESCAPE_SEQUENCES.put("\\" + character, sentinel);
        RAW_CHARACTERS.put(character, sentinel);
        SENTINELS.put(sentinel, character);
    }

    /**
     * Replaces backslash escape sequences in a raw pattern with sentinels.
     */
    public String escape(String pattern) {
        return replaceAll(pattern, ESCAPE_SEQUENCES);
    }

    /**
     * Replaces raw reserved characters in a generated value with sentinels.
     */
    public String escapeValue(String value) {
        return replaceAll(value, RAW_CHARACTERS);
    }

    /**
     * Turns sentinels back into the literal characters they stand for.
     */
    public String unescape(String text) {
        return replaceAll(text, SENTINELS);
    }

    private static String replaceAll(String text, Map<String, String> replacements) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }
}
