package com.passpattern.generator.wordlist;

import com.passpattern.generator.random.WeightedRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Word lists stored as {@code <name>.txt} files in a directory.
 *
 * <p>Small files are loaded whole and cached. Files of {@value #SAMPLING_THRESHOLD} bytes or more
 * are sampled in place: a short window is read at a random offset and the first complete line in
 * it is used, so huge dictionaries never need to be held in memory.
 */
public class DirectoryWordListSource implements WordListSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryWordListSource.class);

    static final long SAMPLING_THRESHOLD = 100_000;
    static final int WINDOW_SIZE = 128;
    static final int SAMPLING_ATTEMPTS = 5;

    private final Path directory;
    private final WordListCache cache;
    private final WeightedRandom random;

    public DirectoryWordListSource(Path directory, WordListCache cache, WeightedRandom random) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.random = Objects.requireNonNull(random, "random");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String lookupWord(String listName) throws WordListNotFoundException {
        Path file = findList(listName);
        try {
            if (Files.size(file) >= SAMPLING_THRESHOLD) {
                String sampled = sample(file);
                if (sampled != null) {
                    return sampled;
                }
            }
            List<String> words = load(listName, file);
            return words.isEmpty() ? "" : words.get(random.index(words.size()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read word list: " + file, e);
        }
    }

    /**
     * Exact file name first, then the lower-cased name.
     */
    Path findList(String listName) throws WordListNotFoundException {
        if (listName == null || listName.isBlank()) {
            throw new WordListNotFoundException(String.valueOf(listName), directory.toString());
        }
        Path exact = directory.resolve(WordLists.fileName(listName));
        if (Files.isRegularFile(exact)) {
            return exact;
        }
        Path lower = directory.resolve(WordLists.fileName(listName.toLowerCase(Locale.ROOT)));
        if (Files.isRegularFile(lower)) {
            return lower;
        }
        throw new WordListNotFoundException(listName, directory.toString());
    }

    private List<String> load(String listName, Path file) throws IOException {
        String key = WordLists.cacheKey(directory.toString(), listName);
        var cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<String> words;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                Files.newInputStream(file), StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.IGNORE)
                        .onUnmappableCharacter(CodingErrorAction.IGNORE)))) {
            words = WordLists.readEntries(reader);
        }
        cache.put(key, words);
        log.debug("Loaded word list {} ({} entries) from {}", listName, words.size(), file);
        return words;
    }

    /**
     * Returns the second line of a random window, or {@code null} when no attempt found one.
     */
    private String sample(Path file) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(file)) {
            long size = channel.size();
            for (int attempt = 0; attempt < SAMPLING_ATTEMPTS; attempt++) {
                long offset = random.rand((int) Math.min(Integer.MAX_VALUE, size - WINDOW_SIZE), 1);
                channel.position(offset);

                ByteBuffer buffer = ByteBuffer.allocate(WINDOW_SIZE);
                channel.read(buffer);
                buffer.flip();
                String window = StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.IGNORE)
                        .onUnmappableCharacter(CodingErrorAction.IGNORE)
                        .decode(buffer)
                        .toString();

                String[] lines = window.split("\n", -1);
                if (lines.length >= 3) {
                    String word = lines[1].trim();
                    if (!word.isEmpty()) {
                        return word;
                    }
                }
            }
        }
        log.debug("Sampling {} found no complete line, loading it whole", file);
        return null;
    }
}
