package com.passpattern.generator.text;

import com.passpattern.generator.random.WeightedRandom;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for generated pronounceable words.
 */
class PronounceableWordGeneratorTest {

    private final PronounceableWordGenerator generator = new PronounceableWordGenerator(WeightedRandom.secure());

    @Test
    void testWordsAreLowerCaseLetters() {
        for (int i = 0; i < 500; i++) {
            assertThat(generator.nextWord()).matches("[a-z]+");
        }
    }

    @Test
    void testAwkwardDoublesAreRemoved() {
        for (int i = 0; i < 500; i++) {
            String word = generator.nextWord();
            assertThat(word).doesNotContain("aa", "hh", "ii", "jj", "kk", "uu", "vv", "ww", "xx", "yy");
            if (word.length() >= 2) {
                assertThat(word.charAt(0)).isNotEqualTo(word.charAt(1));
            }
        }
    }
}
