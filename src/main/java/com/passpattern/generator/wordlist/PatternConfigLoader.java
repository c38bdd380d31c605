package com.passpattern.generator.wordlist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parser for {@code patterns.cfg} files.
 *
 * Format:
 * - Named pattern: Three words: {word}.{word}.{word}
 * - Bare pattern: {word(animal)}{number(99)}
 * - Comments: # comment
 */
public class PatternConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PatternConfigLoader.class);

    public static final String FILE_NAME = "patterns.cfg";
    public static final String CLASSPATH_LOCATION = "wordlists/" + FILE_NAME;

    public List<PatternEntry> load(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<PatternEntry> entries = parse(lines);
        log.debug("Loaded {} patterns from {}", entries.size(), file);
        return entries;
    }

    /**
     * Loads the bundled pattern file; an absent resource yields an empty list.
     */
    public List<PatternEntry> loadBundled() throws IOException {
        InputStream in = PatternConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_LOCATION);
        if (in == null) {
            log.warn("Bundled {} not found on the classpath", CLASSPATH_LOCATION);
            return List.of();
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(reader.lines().collect(Collectors.toList()));
        }
    }

    public List<PatternEntry> parse(List<String> lines) {
        List<PatternEntry> entries = new ArrayList<>();

        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            int colon = trimmed.indexOf(':');
            if (colon >= 0) {
                entries.add(new PatternEntry(trimmed.substring(0, colon).trim(), trimmed.substring(colon + 1).trim()));
            } else {
                entries.add(new PatternEntry("", trimmed));
            }
        }

        return entries;
    }
}
