package com.passpattern.generator.wordlist;

import com.passpattern.generator.random.WeightedRandom;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the word lists bundled with the generator.
 */
class ClasspathWordListSourceTest {

    private final ClasspathWordListSource source =
            new ClasspathWordListSource(new WordListCache(), WeightedRandom.secure());

    @ParameterizedTest
    @ValueSource(strings = {"4-letter", "animal", "color", "noun", "adjective", "verb"})
    void testBundledListsExist(String name) throws Exception {
        assertThat(source.load(name)).isNotEmpty();
    }

    @Test
    void testFourLetterWordsAreAlphabetic() throws Exception {
        assertThat(source.load("4-letter")).allMatch(word -> word.matches("[a-z]{4}"));
    }

    @Test
    void testMissingListThrows() {
        assertThatThrownBy(() -> source.lookupWord("nosuchlist"))
                .isInstanceOf(WordListNotFoundException.class);
    }
}
