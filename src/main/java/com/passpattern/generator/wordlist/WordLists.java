package com.passpattern.generator.wordlist;

import lombok.experimental.UtilityClass;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Naming and parsing rules shared by the word-list sources.
 */
@UtilityClass
class WordLists {

    static final String EXTENSION = ".txt";

    static String fileName(String listName) {
        return listName.toLowerCase(Locale.ROOT).endsWith(EXTENSION) ? listName : listName + EXTENSION;
    }

    static String cacheKey(String location, String listName) {
        return location + ":" + listName.toLowerCase(Locale.ROOT);
    }

    /**
     * Reads one entry per line, trimmed, skipping blank lines.
     */
    static List<String> readEntries(BufferedReader reader) throws IOException {
        List<String> words = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                words.add(trimmed);
            }
        }
        return words;
    }
}
