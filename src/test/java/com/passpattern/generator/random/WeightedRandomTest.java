package com.passpattern.generator.random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the biased random primitive and its pick helpers.
 */
class WeightedRandomTest {

    private final WeightedRandom random = WeightedRandom.secure();

    @ParameterizedTest
    @CsvSource({
            "10, 1, 1",
            "100, 0, 5",
            "100, 0, -5",
            "7, 3, 0",
            "1, 0, 1"
    })
    void testRandStaysWithinBounds(int max, int min, int weight) {
        for (int i = 0; i < 500; i++) {
            assertThat(random.rand(max, min, weight)).isBetween(min, max);
        }
    }

    @Test
    void testZeroMaxMeansNine() {
        for (int i = 0; i < 500; i++) {
            assertThat(random.rand(0)).isBetween(0, 9);
        }
        WeightedRandom top = ScriptedSecureRandom.highest();
        assertThat(top.rand(0)).isEqualTo(9);
    }

    @Test
    void testPositiveWeightLeansHighNegativeLeansLow() {
        double high = IntStream.range(0, 2000).map(i -> random.rand(100, 0, 10)).average().orElse(0);
        double low = IntStream.range(0, 2000).map(i -> random.rand(100, 0, -10)).average().orElse(0);

        assertThat(high).isGreaterThan(80);
        assertThat(low).isLessThan(20);
    }

    @Test
    void testZeroWeightBehavesLikeOne() {
        WeightedRandom scripted = new WeightedRandom(new ScriptedSecureRandom(0.25));

        assertThat(scripted.rand(100, 0, 0)).isEqualTo(scripted.rand(100, 0, 1));
    }

    @Test
    void testScriptedDrawsHitTheEnds() {
        assertThat(ScriptedSecureRandom.lowest().rand(50, 5)).isEqualTo(5);
        assertThat(ScriptedSecureRandom.highest().rand(50, 5)).isEqualTo(50);
    }

    @Test
    void testDecimalsRoundToRequestedPlaces() {
        for (int i = 0; i < 200; i++) {
            double value = random.rand(10.0, 0.0, 1, 2);
            assertThat(value).isBetween(0.0, 10.0);
            assertThat(Math.round(value * 100) / 100.0).isEqualTo(value);
        }
    }

    @Test
    void testChanceExtremes() {
        for (int i = 0; i < 200; i++) {
            assertThat(random.chance(100)).isTrue();
            assertThat(random.chance(0)).isFalse();
        }
    }

    @Test
    void testIndexNeverLeavesTheCollection() {
        assertThat(random.index(1)).isZero();
        assertThat(random.index(0)).isZero();
        for (int i = 0; i < 300; i++) {
            assertThat(random.index(3)).isBetween(0, 2);
        }
    }

    @Test
    void testPickOneEdgeCases() {
        assertThat(random.pickOne(List.of())).isEmpty();
        assertThat(random.pickOne(List.of("  only "))).isEqualTo("only");
        assertThat(random.pickOne("a b c")).isIn("a", "b", "c");
        assertThat(random.pickOne("x|y", 1, "|")).isIn("x", "y");
    }

    @Test
    void testPickOneKeepsEmptyParts() {
        WeightedRandom first = ScriptedSecureRandom.lowest();

        assertThat(first.pickOne(" a b")).isEmpty();
        assertThat(ScriptedSecureRandom.highest().pickOne("a b ")).isEmpty();
    }

    @Test
    void testPickCharacter() {
        assertThat(random.pickCharacter("")).isEmpty();
        for (int i = 0; i < 200; i++) {
            assertThat("abc").contains(random.pickCharacter("abc"));
        }
        assertThat(ScriptedSecureRandom.lowest().pickCharacter("xyz", 1)).isEqualTo("x");
        assertThat(ScriptedSecureRandom.highest().pickCharacter("xyz", 1)).isEqualTo("z");
    }
}
