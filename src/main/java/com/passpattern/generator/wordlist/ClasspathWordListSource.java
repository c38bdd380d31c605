package com.passpattern.generator.wordlist;

import com.passpattern.generator.random.WeightedRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Word lists bundled on the classpath, under {@value #DEFAULT_BASE} by default.
 */
public class ClasspathWordListSource implements WordListSource {
    private static final Logger log = LoggerFactory.getLogger(ClasspathWordListSource.class);

    public static final String DEFAULT_BASE = "wordlists/";

    private final String basePath;
    private final WordListCache cache;
    private final WeightedRandom random;
    private final ClassLoader classLoader;

    public ClasspathWordListSource(WordListCache cache, WeightedRandom random) {
        this(DEFAULT_BASE, cache, random);
    }

    public ClasspathWordListSource(String basePath, WordListCache cache, WeightedRandom random) {
        this.basePath = basePath.endsWith("/") ? basePath : basePath + "/";
        this.cache = Objects.requireNonNull(cache, "cache");
        this.random = Objects.requireNonNull(random, "random");
        this.classLoader = ClasspathWordListSource.class.getClassLoader();
    }

    @Override
    public String lookupWord(String listName) throws WordListNotFoundException {
        List<String> words = load(listName);
        return words.isEmpty() ? "" : words.get(random.index(words.size()));
    }

    List<String> load(String listName) throws WordListNotFoundException {
        if (listName == null || listName.isBlank()) {
            throw new WordListNotFoundException(String.valueOf(listName), "classpath:" + basePath);
        }
        String key = WordLists.cacheKey("classpath:" + basePath, listName);
        var cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        String resource = basePath + WordLists.fileName(listName);
        InputStream in = classLoader.getResourceAsStream(resource);
        if (in == null) {
            resource = basePath + WordLists.fileName(listName.toLowerCase(Locale.ROOT));
            in = classLoader.getResourceAsStream(resource);
        }
        if (in == null) {
            throw new WordListNotFoundException(listName, "classpath:" + basePath);
        }

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<String> words = WordLists.readEntries(reader);
            cache.put(key, words);
            log.debug("Loaded bundled word list {} ({} entries)", listName, words.size());
            return words;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled word list: " + resource, e);
        }
    }
}
