package com.passpattern.generator.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for escape sequence handling.
 */
class PatternEscaperTest {

    private final PatternEscaper escaper = new PatternEscaper();

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "\\{;#lbr#",
            "\\};#rbr#",
            "\\[;#lba#",
            "\\];#rba#",
            "\\(;#lpa#",
            "\\);#rpa#",
            "\\+;#pls#",
            "\\|;#pip#",
            "\\\\;#sla#"
    })
    void testEscapeSequences(String raw, String sentinel) {
        assertThat(escaper.escape(raw)).isEqualTo(sentinel);
    }

    @Test
    void testEscapedBracesAreNotStructural() {
        String escaped = escaper.escape("\\{word\\}");

        assertThat(escaped).doesNotContain("{").doesNotContain("}");
        assertThat(escaper.unescape(escaped)).isEqualTo("{word}");
    }

    @Test
    void testDoubleBackslashDoesNotEscapeFollowingBrace() {
        String escaped = escaper.escape("\\\\{sp}");

        assertThat(escaped).isEqualTo("#sla#{sp}");
    }

    @Test
    void testEscapeValueHandlesRawCharacters() {
        String escaped = escaper.escapeValue("a+b|{c}");

        assertThat(escaped).isEqualTo("a#pls#b#pip##lbr#c#rbr#");
        assertThat(escaper.unescape(escaped)).isEqualTo("a+b|{c}");
    }

    @Test
    void testPlainTextRoundTrips() {
        String text = "correct horse battery staple 42!";

        assertThat(escaper.unescape(escaper.escape(text))).isEqualTo(text);
        assertThat(escaper.escapeValue(text)).isEqualTo(text);
    }

    @Test
    void testEmptyAndNull() {
        assertThat(escaper.escape("")).isEmpty();
        assertThat(escaper.unescape(null)).isNull();
    }
}
