package com.passpattern.generator.modifier;

import com.passpattern.generator.model.ParameterList;
import com.passpattern.generator.model.ResolutionError;
import com.passpattern.generator.model.ResolutionResult;
import com.passpattern.generator.random.ScriptedSecureRandom;
import com.passpattern.generator.random.WeightedRandom;
import com.passpattern.generator.text.EnglishNumberToWords;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for modifier dispatch and the deterministic modifiers.
 */
class ModifierPipelineTest {

    private final ModifierPipeline pipeline =
            new ModifierPipeline(ScriptedSecureRandom.lowest(), new EnglishNumberToWords());

    private String apply(String value, String name, String... params) {
        ResolutionResult result = pipeline.apply(value, name, ParameterList.of(params));
        assertThat(result.isSuccess()).as("result of %s", name).isTrue();
        return result.getValue();
    }

    @ParameterizedTest
    @CsvSource({
            "apple, a, an apple",
            "dog, a, a dog",
            "abc, reverse, cba",
            "Mixed, ucase, MIXED",
            "Mixed, uppercase, MIXED",
            "Mixed, lcase, mixed",
            "Mixed, LowerCase, mixed",
            "hello world, propercase, Hello World",
            "hELLO wORLD, sentencecase, Hello world",
            "42, num2words, Forty two",
            "105, num2word, One hundred and five",
            "hello world, piglatin, ellohay orldway",
            "Hello, piglatin, Ellohay",
            "apple, piglatin, appleyay",
            "hello world, swap, wello horld",
            "1994, romannumeral, MCMXCIV",
            "abc, romannumeral, abc",
            "secret, hide, ''",
            "x, quote, \"x\""
    })
    void testDeterministicModifiers(String value, String name, String expected) {
        assertThat(apply(value, name)).isEqualTo(expected);
    }

    @Test
    void testRomanNumeralOfZeroIsEmpty() {
        assertThat(apply("0", "romannumeral")).isEmpty();
        assertThat(apply(" 7 ", "romannumeral")).isEqualTo("VII");
    }

    @Test
    void testReplace() {
        assertThat(apply("a b c", "replace", " ", "-")).isEqualTo("a-b-c");
        assertThat(apply("abc", "replace", "z", "y")).isEqualTo("abc");
    }

    @Test
    void testRepeat() {
        assertThat(apply("ab", "repeat")).isEqualTo("abab");
        assertThat(apply("ab", "repeat", "2")).isEqualTo("ababab");
        assertThat(apply("ab", "repeat", "-5")).isEqualTo("ab");
    }

    @Test
    void testLeftAndRight() {
        assertThat(apply("hello", "right", "2")).isEqualTo("lo");
        assertThat(apply("hello", "right", "0")).isEmpty();
        assertThat(apply("hello", "right", "10")).isEqualTo("hello");
        assertThat(apply("hello", "left", "2")).isEqualTo("he");
        assertThat(apply("hello", "left", "-1")).isEmpty();
        assertThat(apply("hello", "left")).isEqualTo("hello");
    }

    @Test
    void testMid() {
        assertThat(apply("abcdef", "mid", "2", "3")).isEqualTo("bcd");
        assertThat(apply("abcdef", "mid")).isEqualTo("a");
        assertThat(apply("abcdef", "mid", "0", "2")).isEqualTo("ab");
        assertThat(apply("abcdef", "mid", "5", "10")).isEqualTo("ef");
        assertThat(apply("abcdef", "mid", "10", "2")).isEmpty();
        assertThat(apply("abcdef", "mid", "2", String.valueOf(Integer.MAX_VALUE))).isEqualTo("bcdef");
    }

    @Test
    void testTrimAndFormat() {
        assertThat(apply("  padded  ", "trim")).isEqualTo("padded");
        assertThat(apply("42", "format", "0000")).isEqualTo("0042");
        assertThat(apply("-7", "format", "000")).isEqualTo("-07");
        assertThat(apply("42", "format", "#")).isEqualTo("42");
        assertThat(apply("12345", "format", "00")).isEqualTo("12345");
    }

    @Test
    void testNamesAreCaseInsensitive() {
        assertThat(apply("abc", "UpperCase")).isEqualTo("ABC");
        assertThat(pipeline.isKnown("PigLatin")).isTrue();
        assertThat(pipeline.isKnown("bogus")).isFalse();
    }

    @Test
    void testUnknownModifierFails() {
        ResolutionResult result = pipeline.apply("abc", "bogus", ParameterList.empty());

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getError()).isEqualTo(ResolutionError.UNKNOWN_MODIFIER);
        assertThat(result.getErrorMessage()).contains("bogus");
    }

    @Test
    void testUnknownModifierFailsEvenOnEmptyValue() {
        assertThat(pipeline.apply("", "bogus", ParameterList.empty()).isFailure()).isTrue();
    }

    @Test
    void testEmptyValuePassesThroughKnownModifiers() {
        for (String name : pipeline.names()) {
            assertThat(apply("", name)).as(name).isEmpty();
        }
    }

    @Test
    void testRandomModifierAlwaysSucceeds() {
        ModifierPipeline secure = new ModifierPipeline(WeightedRandom.secure(), new EnglishNumberToWords());

        for (int i = 0; i < 100; i++) {
            ResolutionResult result = secure.apply("hello world", "random", ParameterList.empty());
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getValue()).isNotNull();
        }
    }

    @Test
    void testRepeatIsBounded() {
        assertThat(apply("ab", "repeat", "1000000000")).hasSize(2 * (ParameterList.MAX_COUNT + 1));
        assertThat(apply("ab", "repeat", String.valueOf(Integer.MAX_VALUE))).hasSize(2 * (ParameterList.MAX_COUNT + 1));
        assertThat(apply("x".repeat(1024), "repeat", "1000")).hasSize(ModifierPipeline.MAX_REPEATED_LENGTH);
    }

    @Test
    void testScrambleWithHugeCountKeepsLetters() {
        char[] letters = apply("abcd", "scramble", String.valueOf(Integer.MAX_VALUE)).toCharArray();
        Arrays.sort(letters);

        assertThat(new String(letters)).isEqualTo("abcd");
    }

    @Test
    void testCaseChangesIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(apply("title", "uppercase")).isEqualTo("TITLE");
            assertThat(apply("TITLE", "lowercase")).isEqualTo("title");
            assertThat(apply("istanbul", "propercase")).isEqualTo("Istanbul");
            assertThat(apply("IZMIR", "sentencecase")).isEqualTo("Izmir");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
