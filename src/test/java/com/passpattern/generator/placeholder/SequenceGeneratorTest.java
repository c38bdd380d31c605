package com.passpattern.generator.placeholder;

import com.passpattern.generator.model.ParameterList;
import com.passpattern.generator.random.ScriptedSecureRandom;
import com.passpattern.generator.random.WeightedRandom;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for keyboard sequences and number patterns.
 */
class SequenceGeneratorTest {

    private final SequenceGenerator sequences = new SequenceGenerator(WeightedRandom.secure());
    private final NumberPatternGenerator numberPatterns = new NumberPatternGenerator(WeightedRandom.secure());

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 7, 12, 30})
    void testSequenceHasRequestedLength(int length) {
        for (int i = 0; i < 300; i++) {
            assertThat(sequences.generate(length)).hasSize(length).matches("[a-z0-9]+");
        }
    }

    @Test
    void testNonPositiveLengthMeansThree() {
        assertThat(sequences.generate(0)).hasSize(3);
        assertThat(sequences.generate(-4)).hasSize(3);
    }

    @Test
    void testAlphabetRun() {
        // rand(19) lands on 1 and the window starts at the first letter
        SequenceGenerator scripted = new SequenceGenerator(new WeightedRandom(new ScriptedSecureRandom(0.95, 0.999999)));

        assertThat(scripted.generate(4)).isEqualTo("abcd");
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 8})
    void testNumberPatternIsDigits(int length) {
        for (int i = 0; i < 300; i++) {
            assertThat(numberPatterns.generate(length)).hasSize(length).matches("\\d+");
        }
    }

    @Test
    void testHugeLengthsAreCapped() {
        assertThat(sequences.generate(Integer.MAX_VALUE)).hasSize(ParameterList.MAX_COUNT);
        assertThat(numberPatterns.generate(Integer.MAX_VALUE)).hasSize(ParameterList.MAX_COUNT).matches("\\d+");
    }
}
