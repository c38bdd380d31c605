package com.passpattern.generator.model;

import java.util.List;

/**
 * Positional placeholder or modifier parameters with typed, defaulting accessors.
 *
 * <p>Missing, blank and malformed values all fall back to the caller's default.
 */
public class ParameterList {

    /** Upper bound for lengths, counts and repetitions read with {@link #countAt(int, int)}. */
    public static final int MAX_COUNT = 1024;

    private static final ParameterList EMPTY = new ParameterList(List.of());

    private final List<String> values;

    public ParameterList(List<String> values) {
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    public static ParameterList empty() {
        return EMPTY;
    }

    public static ParameterList of(String... values) {
        return new ParameterList(List.of(values));
    }

    public int size() {
        return values.size();
    }

    public List<String> asList() {
        return values;
    }

    public boolean isPresent(int index) {
        return index < values.size() && !values.get(index).isEmpty();
    }

    public String stringAt(int index, String defaultValue) {
        return isPresent(index) ? values.get(index) : defaultValue;
    }

    public int intAt(int index, int defaultValue) {
        if (!isPresent(index)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(values.get(index).trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Like {@link #intAt(int, int)} but never above {@link #MAX_COUNT}.
     */
    public int countAt(int index, int defaultValue) {
        return Math.min(intAt(index, defaultValue), MAX_COUNT);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
