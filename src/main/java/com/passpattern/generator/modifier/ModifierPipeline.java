package com.passpattern.generator.modifier;

import com.passpattern.generator.model.ParameterList;
import com.passpattern.generator.model.ResolutionError;
import com.passpattern.generator.model.ResolutionResult;
import com.passpattern.generator.random.WeightedRandom;
import com.passpattern.generator.text.NumberToWords;
import com.passpattern.generator.text.TextFormats;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Applies modifiers by name. Names are matched case-insensitively.
 *
 * <p>An unknown name fails the current attempt. Every known modifier returns an empty value
 * unchanged.
 */
public class ModifierPipeline {

    /** Longest value {@code repeat} will build. */
    static final int MAX_REPEATED_LENGTH = 64 * ParameterList.MAX_COUNT;

    static final String RANDOM_CANDIDATES = "bracket num2words randomcase reverse obscure piglatin scramble swap";

    private final Map<String, Modifier> modifiers = new HashMap<>();
    private final WeightedRandom random;

    public ModifierPipeline(WeightedRandom random, NumberToWords numberToWords) {
        this(random, numberToWords, new TextTransforms(random));
    }

    public ModifierPipeline(WeightedRandom random, NumberToWords numberToWords, TextTransforms transforms) {
        this.random = random;

        register((value, params) -> article(value), "a");
        register((value, params) -> transforms.bracket(value, params.stringAt(0, "")), "bracket");
        register((value, params) -> TextFormats.sentenceCase(numberToWords.toWords(value)), "num2word", "num2words");
        register((value, params) -> new StringBuilder(value).reverse().toString(), "reverse");
        register((value, params) -> value.toUpperCase(Locale.ROOT), "ucase", "uppercase");
        register((value, params) -> value.toLowerCase(Locale.ROOT), "lcase", "lowercase");
        register((value, params) -> TextFormats.titleCase(value), "propercase");
        register((value, params) -> TextFormats.sentenceCase(value), "sentencecase");
        register((value, params) -> transforms.obscure(value), "obscure");
        register((value, params) -> value.replace(params.stringAt(0, ""), params.stringAt(1, "")), "replace");
        register((value, params) -> transforms.randomCase(value), "randomcase");
        register((value, params) -> transforms.scramble(value, params.countAt(0, 1)), "scramble");
        register((value, params) -> transforms.pigLatin(value), "piglatin");
        register(ModifierPipeline::repeat, "repeat");
        register(ModifierPipeline::right, "right");
        register(ModifierPipeline::left, "left");
        register((value, params) -> value.trim(), "trim");
        register(ModifierPipeline::format, "format");
        register(ModifierPipeline::mid, "mid");
        register((value, params) -> transforms.swapInitials(value), "swap");
        register(ModifierPipeline::romanNumeral, "romannumeral");
        register((value, params) -> "", "hide");
        register((value, params) -> "\"" + value + "\"", "quote");
        register((value, params) -> transforms.stutter(value), "stutter");
        register(this::randomModifier, "random");
    }

    private void register(Modifier modifier, String... names) {
        for (String name : names) {
            modifiers.put(name, modifier);
        }
    }

    public boolean isKnown(String name) {
        return name != null && modifiers.containsKey(normalize(name));
    }

    public Set<String> names() {
        return Set.copyOf(modifiers.keySet());
    }

    /**
     * Applies the named modifier to {@code value}.
     *
     * @return the modified value, or an {@link ResolutionError#UNKNOWN_MODIFIER} failure
     */
    public ResolutionResult apply(String value, String name, ParameterList params) {
        Modifier modifier = name == null ? null : modifiers.get(normalize(name));
        if (modifier == null) {
            return ResolutionResult.failure(ResolutionError.UNKNOWN_MODIFIER, "Unknown modifier: " + name);
        }
        if (value == null || value.isEmpty()) {
            return ResolutionResult.ok(value == null ? "" : value);
        }
        return ResolutionResult.ok(modifier.apply(value, params == null ? ParameterList.empty() : params));
    }

    private String randomModifier(String value, ParameterList params) {
        String chosen = random.pickOne(RANDOM_CANDIDATES);
        return modifiers.get(chosen).apply(value, params);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static String article(String value) {
        return ("aeiou".indexOf(Character.toLowerCase(value.charAt(0))) >= 0 ? "an " : "a ") + value;
    }

    // n further copies; negative counts leave the value as is
    private static String repeat(String value, ParameterList params) {
        int copies = Math.max(1, params.countAt(0, 1) + 1);
        copies = Math.min(copies, Math.max(1, MAX_REPEATED_LENGTH / value.length()));
        return value.repeat(copies);
    }

    private static String right(String value, ParameterList params) {
        int n = clamp(params.intAt(0, value.length()), value.length());
        return value.substring(value.length() - n);
    }

    private static String left(String value, ParameterList params) {
        int n = clamp(params.intAt(0, value.length()), value.length());
        return value.substring(0, n);
    }

    /**
     * 1-indexed substring; a start before the first character is treated as 1.
     */
    private static String mid(String value, ParameterList params) {
        int start = Math.max(1, params.intAt(0, 1)) - 1;
        int length = Math.max(0, params.intAt(1, 1));
        if (start >= value.length()) {
            return "";
        }
        return value.substring(start, (int) Math.min(value.length(), (long) start + length));
    }

    private static String format(String value, ParameterList params) {
        String mask = params.stringAt(0, "0");
        if (mask.indexOf('0') < 0) {
            return value;
        }
        int width = (int) mask.chars().filter(c -> c == '0').count();
        return TextFormats.zeroFill(value, width);
    }

    private static String romanNumeral(String value, ParameterList params) {
        try {
            return TextFormats.toRoman(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static int clamp(int n, int length) {
        return Math.max(0, Math.min(n, length));
    }
}
