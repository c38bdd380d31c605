package com.passpattern.generator.text;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TextFormats.
 */
class TextFormatsTest {

    @ParameterizedTest
    @CsvSource({
            "1, 1st", "2, 2nd", "3, 3rd", "4, 4th",
            "11, 11th", "12, 12th", "13, 13th",
            "21, 21st", "22, 22nd", "111, 111th", "101, 101st"
    })
    void testOrdinal(int number, String expected) {
        assertThat(TextFormats.ordinal(number)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "1, I", "4, IV", "9, IX", "14, XIV", "40, XL", "1994, MCMXCIV", "3999, MMMCMXCIX"
    })
    void testToRoman(int number, String expected) {
        assertThat(TextFormats.toRoman(number)).isEqualTo(expected);
    }

    @Test
    void testToRomanNonPositive() {
        assertThat(TextFormats.toRoman(0)).isEmpty();
        assertThat(TextFormats.toRoman(-5)).isEmpty();
    }

    @Test
    void testCaseHelpers() {
        assertThat(TextFormats.sentenceCase("hELLO wORLD")).isEqualTo("Hello world");
        assertThat(TextFormats.titleCase("hELLO wORLD-wide")).isEqualTo("Hello World-Wide");
        assertThat(TextFormats.sentenceCase("")).isEmpty();
    }

    @Test
    void testPhonetic() {
        assertThat(TextFormats.phonetic("ab1", 0)).isEqualTo("Alpha Bravo");
        assertThat(TextFormats.phonetic("ab", 2)).isEqualTo("Adam Baker");
    }

    @Test
    void testZeroFill() {
        assertThat(TextFormats.zeroFill("7", 3)).isEqualTo("007");
        assertThat(TextFormats.zeroFill("-7", 3)).isEqualTo("-07");
        assertThat(TextFormats.zeroFill("1234", 3)).isEqualTo("1234");
    }
}
