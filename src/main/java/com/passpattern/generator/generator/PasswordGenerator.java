package com.passpattern.generator.generator;

import com.passpattern.generator.model.ResolutionResult;
import com.passpattern.generator.modifier.ModifierPipeline;
import com.passpattern.generator.modifier.TextTransforms;
import com.passpattern.generator.parser.PatternEscaper;
import com.passpattern.generator.parser.PlaceholderContentParser;
import com.passpattern.generator.placeholder.BuiltinValueDispatcher;
import com.passpattern.generator.placeholder.CharacterSets;
import com.passpattern.generator.random.WeightedRandom;
import com.passpattern.generator.resolver.BackreferenceStore;
import com.passpattern.generator.resolver.PatternResolver;
import com.passpattern.generator.text.EnglishNumberToWords;
import com.passpattern.generator.text.PronounceableWordGenerator;
import com.passpattern.generator.wordlist.ClasspathWordListSource;
import com.passpattern.generator.wordlist.DirectoryWordListSource;
import com.passpattern.generator.wordlist.NoPatternsException;
import com.passpattern.generator.wordlist.PatternConfigLoader;
import com.passpattern.generator.wordlist.PatternConfigSource;
import com.passpattern.generator.wordlist.PatternEntry;
import com.passpattern.generator.wordlist.PatternSource;
import com.passpattern.generator.wordlist.WordListCache;
import com.passpattern.generator.wordlist.WordListSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns patterns into passwords.
 *
 * <p>Each call makes up to {@code maxAttempts} attempts. An attempt that fails (unknown modifier,
 * missing word list, runaway nesting, no patterns to draw from) is discarded. When every attempt
 * fails a failsafe password is returned instead, so {@link #generate()} always yields a value.
 *
 * <p>Instances keep per-call state in a {@link GenerationSession} and are not thread-safe.
 */
public class PasswordGenerator {
    private static final Logger log = LoggerFactory.getLogger(PasswordGenerator.class);

    static final String FAILSAFE_ITEMS = CharacterSets.VOWELS2
            + " ! @ # % $ ^ & * : ' / ` ~ * - < > + = . . , , ; ; ? ? "
            + CharacterSets.CONSONANTS2 + " " + CharacterSets.THREE_LETTER_WORDS
            + " 1 2 3 4 5 6 7 8 9 0";
    static final int FAILSAFE_PARTS = 7;

    private final PatternResolver resolver;
    private final PatternEscaper escaper;
    private final PatternSource patterns;
    private final WeightedRandom random;
    private final int maxAttempts;
    private final GenerationSession session = new GenerationSession();

    public PasswordGenerator(PatternResolver resolver,
                             PatternEscaper escaper,
                             PatternSource patterns,
                             WeightedRandom random,
                             int maxAttempts) {
        this.resolver = resolver;
        this.escaper = escaper;
        this.patterns = patterns;
        this.random = random;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Wires a generator from {@code config}: word lists and {@code patterns.cfg} come from the
     * configured directory when there is one, otherwise from the classpath.
     */
    public static PasswordGenerator create(GeneratorConfig config) {
        WeightedRandom random = WeightedRandom.secure();
        WordListCache cache = new WordListCache();
        Path dir = config.getWordlistDir();

        WordListSource wordLists = dir != null
                ? new DirectoryWordListSource(dir, cache, random)
                : new ClasspathWordListSource(cache, random);

        TextTransforms transforms = new TextTransforms(random);
        PatternEscaper escaper = new PatternEscaper();
        PatternResolver resolver = new PatternResolver(
                new PlaceholderContentParser(),
                new BuiltinValueDispatcher(random, wordLists, new PronounceableWordGenerator(random), transforms),
                new ModifierPipeline(random, new EnglishNumberToWords(), transforms),
                escaper,
                random,
                config.getMaxNestingDepth());

        PatternSource patterns = new PatternConfigSource(loadPatterns(dir), random);
        return new PasswordGenerator(resolver, escaper, patterns, random, config.getMaxAttempts());
    }

    private static List<PatternEntry> loadPatterns(Path dir) {
        PatternConfigLoader loader = new PatternConfigLoader();
        try {
            if (dir != null && Files.isRegularFile(dir.resolve(PatternConfigLoader.FILE_NAME))) {
                return loader.load(dir.resolve(PatternConfigLoader.FILE_NAME));
            }
            return loader.loadBundled();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PatternConfigLoader.FILE_NAME, e);
        }
    }

    public GenerationSession getSession() {
        return session;
    }

    /**
     * Generates a password from a pattern drawn from the configured pattern source.
     */
    public String generate() {
        return generate(null);
    }

    /**
     * Generates a password from {@code pattern}; a {@code null} or empty pattern draws one from the
     * pattern source on every attempt.
     */
    public String generate(String pattern) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String current = pattern;
            if (current == null || current.isEmpty()) {
                try {
                    current = patterns.randomPattern();
                } catch (NoPatternsException e) {
                    log.debug("Attempt {} failed: {}", attempt, e.getMessage());
                    continue;
                }
            }

            BackreferenceStore store = session.beginAttempt();
            ResolutionResult result;
            try {
                result = resolver.resolve(escaper.escape(current), store);
            } catch (RuntimeException e) {
                log.debug("Attempt {} for pattern '{}' failed with exception", attempt, current, e);
                continue;
            }
            if (result.isFailure()) {
                log.debug("Attempt {} for pattern '{}' failed: {}", attempt, current, result);
                continue;
            }

            String password = tidy(escaper.unescape(result.getValue()));
            session.setLastPattern(current);
            session.setLastPassword(password);
            session.setLastAttempts(attempt);
            session.setUsedFailsafe(false);
            return password;
        }

        String failsafe = failsafe();
        log.warn("All {} attempts failed, returning a failsafe password", maxAttempts);
        session.setLastAttempts(maxAttempts);
        session.setUsedFailsafe(true);
        return failsafe;
    }

    /**
     * Seven random picks of vowel clusters, symbols, consonant clusters, short words and digits.
     */
    String failsafe() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < FAILSAFE_PARTS; i++) {
            sb.append(random.pickOne(FAILSAFE_ITEMS));
        }
        return sb.toString();
    }

    static String tidy(String text) {
        String result = text;
        while (result.contains("  ")) {
            result = result.replace("  ", " ");
        }
        return result.trim();
    }
}
