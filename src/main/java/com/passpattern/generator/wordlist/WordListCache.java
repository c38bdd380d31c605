package com.passpattern.generator.wordlist;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loaded word lists keyed by location and lower-cased list name.
 *
 * <p>Owned by a word-list source; pass the same instance to several sources to share loads.
 */
public class WordListCache {

    private final Map<String, List<String>> lists = new ConcurrentHashMap<>();

    public Optional<List<String>> get(String key) {
        return Optional.ofNullable(lists.get(key));
    }

    public void put(String key, List<String> words) {
        lists.put(key, List.copyOf(words));
    }

    public int size() {
        return lists.size();
    }

    public void clear() {
        lists.clear();
    }
}
