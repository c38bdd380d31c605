package com.passpattern.generator.random;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Random numbers with directional bias, plus the pick helpers built on them.
 *
 * <p>The bias works by narrowing: the ceiling starts at {@code max} and is redrawn
 * {@code |weight|} times between {@code min} and the current ceiling. A positive weight
 * reflects the result so it leans toward {@code max}; a negative weight leans toward {@code min}.
 *
 * <p>Instances hold no state besides the entropy source and can be shared between threads.
 */
public class WeightedRandom {

    private static final WeightedRandom SECURE = new WeightedRandom(new SecureRandom());

    /** Legacy default range used when a caller passes {@code max = 0}. */
    static final int LEGACY_DEFAULT_MAX = 9;

    private final SecureRandom source;

    public WeightedRandom(SecureRandom source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Shared instance backed by a default {@link SecureRandom}.
     */
    public static WeightedRandom secure() {
        return SECURE;
    }

    public int rand(int max) {
        return rand(max, 0, 1);
    }

    public int rand(int max, int min) {
        return rand(max, min, 1);
    }

    /**
     * Draws an integer in {@code [min, max]}, biased by {@code weight}.
     */
    public int rand(int max, int min, int weight) {
        double ceiling = weightedCeiling(max, min, weight);
        return (int) Math.rint(ceiling);
    }

    /**
     * Draws a value in {@code [min, max]} rounded to {@code decimals} fractional digits.
     * With {@code decimals <= 0} the result is a whole number.
     */
    public double rand(double max, double min, int weight, int decimals) {
        double ceiling = weightedCeiling(max, min, weight);
        if (decimals > 0) {
            return BigDecimal.valueOf(ceiling).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
        }
        return Math.rint(ceiling);
    }

    private double weightedCeiling(double max, double min, int weight) {
        if (max == 0) {
            max = LEGACY_DEFAULT_MAX;
        }
        if (weight == 0) {
            weight = 1;
        }

        double ceiling = max;
        for (int i = 0; i < Math.abs(weight); i++) {
            double draw = source.nextDouble();
            ceiling = draw * (ceiling - min) + min;
        }

        if (weight > 0) {
            ceiling = max - (ceiling - min);
        }
        return ceiling;
    }

    /**
     * True when {@code rand(100, 1)} lands at or below {@code percent}.
     */
    public boolean chance(int percent) {
        return rand(100, 1, 1) <= percent;
    }

    /**
     * Uniform index into a collection of {@code size} elements. Never triggers the legacy
     * {@code max = 0} range, so a single-element collection always yields 0.
     */
    public int index(int size) {
        if (size <= 1) {
            return 0;
        }
        return rand(size - 1, 0);
    }

    public String pickOne(String items) {
        return pickOne(items, 1, " ");
    }

    public String pickOne(String items, int weight) {
        return pickOne(items, weight, " ");
    }

    /**
     * Splits {@code items} on {@code delimiter} (empty parts are kept) and returns one trimmed part.
     */
    public String pickOne(String items, int weight, String delimiter) {
        if (items == null) {
            return "";
        }
        String[] parts = items.split(Pattern.quote(delimiter), -1);
        return pickOne(Arrays.asList(parts), weight);
    }

    public String pickOne(List<String> items) {
        return pickOne(items, 1);
    }

    public String pickOne(List<String> items, int weight) {
        if (items == null || items.isEmpty()) {
            return "";
        }
        if (items.size() == 1) {
            return items.get(0).trim();
        }
        int index = rand(items.size() - 1, 0, weight);
        return items.get(index).trim();
    }

    public String pickCharacter(String characters) {
        return pickCharacter(characters, 0);
    }

    /**
     * Returns the character at {@code rand(length, 1, weight) - 1}.
     */
    public String pickCharacter(String characters, int weight) {
        if (characters == null || characters.isEmpty()) {
            return "";
        }
        int index = rand(characters.length(), 1, weight) - 1;
        return String.valueOf(characters.charAt(index));
    }
}
