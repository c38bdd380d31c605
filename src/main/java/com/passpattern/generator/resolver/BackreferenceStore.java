package com.passpattern.generator.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Values produced during one generation attempt, keyed 1..n in resolution order.
 * {@code {$W2}} reads back the second recorded value.
 */
public class BackreferenceStore {

    private final List<String> values = new ArrayList<>();

    /**
     * Records {@code value} and returns its key.
     */
    public int record(String value) {
        values.add(value);
        return values.size();
    }

    public Optional<String> get(int key) {
        if (key < 1 || key > values.size()) {
            return Optional.empty();
        }
        return Optional.of(values.get(key - 1));
    }

    /**
     * The value stored under {@code key}, or an empty string.
     */
    public String valueOf(int key) {
        return get(key).orElse("");
    }

    public int size() {
        return values.size();
    }

    public List<String> values() {
        return List.copyOf(values);
    }
}
