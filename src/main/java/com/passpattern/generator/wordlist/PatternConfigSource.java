package com.passpattern.generator.wordlist;

import com.passpattern.generator.random.WeightedRandom;

import java.util.List;
import java.util.Objects;

/**
 * Picks uniformly among the entries of a loaded {@code patterns.cfg}.
 */
public class PatternConfigSource implements PatternSource {

    private final List<PatternEntry> entries;
    private final WeightedRandom random;

    public PatternConfigSource(List<PatternEntry> entries, WeightedRandom random) {
        this.entries = List.copyOf(entries);
        this.random = Objects.requireNonNull(random, "random");
    }

    public List<PatternEntry> getEntries() {
        return entries;
    }

    @Override
    public String randomPattern() throws NoPatternsException {
        if (entries.isEmpty()) {
            throw new NoPatternsException("No patterns found in " + PatternConfigLoader.FILE_NAME);
        }
        return entries.get(random.index(entries.size())).getPattern();
    }
}
