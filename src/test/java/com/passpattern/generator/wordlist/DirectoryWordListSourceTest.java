package com.passpattern.generator.wordlist;

import com.passpattern.generator.random.WeightedRandom;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for directory-backed word lists.
 */
class DirectoryWordListSourceTest {

    @TempDir
    Path dir;

    private final WordListCache cache = new WordListCache();

    private DirectoryWordListSource source() {
        return new DirectoryWordListSource(dir, cache, WeightedRandom.secure());
    }

    @Test
    void testLookupReturnsAnEntry() throws Exception {
        Files.writeString(dir.resolve("animal.txt"), "otter\n\n  heron  \nlynx\n");

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(source().lookupWord("animal"));
        }

        assertThat(seen).containsExactlyInAnyOrder("otter", "heron", "lynx");
    }

    @Test
    void testNameWithExtensionAndCaseFallback() throws Exception {
        Files.writeString(dir.resolve("color.txt"), "teal\n");

        assertThat(source().lookupWord("color.txt")).isEqualTo("teal");
        assertThat(source().lookupWord("COLOR")).isEqualTo("teal");
    }

    @Test
    void testMissingListThrows() {
        WordListNotFoundException e = catchThrowableOfType(
                () -> source().lookupWord("nosuchlist"), WordListNotFoundException.class);

        assertThat(e).hasMessageContaining("nosuchlist");
        assertThat(e.getListName()).isEqualTo("nosuchlist");
    }

    @Test
    void testSmallListsAreCached() throws Exception {
        Path file = dir.resolve("noun.txt");
        Files.writeString(file, "anchor\n");
        DirectoryWordListSource source = source();

        assertThat(source.lookupWord("noun")).isEqualTo("anchor");
        Files.writeString(file, "bucket\n");

        assertThat(source.lookupWord("noun")).isEqualTo("anchor");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void testEmptyListGivesEmptyWord() throws Exception {
        Files.writeString(dir.resolve("empty.txt"), "\n\n");

        assertThat(source().lookupWord("empty")).isEmpty();
    }

    @Test
    void testLargeListsAreSampled() throws IOException, WordListNotFoundException {
        String content = IntStream.range(0, 20_000)
                .mapToObj(i -> String.format("word%05d", i))
                .collect(Collectors.joining("\n", "", "\n"));
        Files.writeString(dir.resolve("big.txt"), content);

        DirectoryWordListSource source = source();
        for (int i = 0; i < 50; i++) {
            assertThat(source.lookupWord("big")).matches("word\\d{5}");
        }
        assertThat(cache.size()).isZero();
    }
}
