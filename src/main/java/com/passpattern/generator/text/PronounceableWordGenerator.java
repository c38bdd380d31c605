package com.passpattern.generator.text;

import com.passpattern.generator.placeholder.CharacterSets;
import com.passpattern.generator.random.WeightedRandom;

import java.util.List;

/**
 * Builds fake words by alternating vowel and consonant clusters, sometimes finishing with a
 * common English ending.
 */
public class PronounceableWordGenerator implements PronounceableWordSource {

    private static final String VOWEL_SUFFIXES =
            "ing ers ance ence le ness ings ment ize ate ive ute acy ous ify "
                    + "ought some edness ed es ly less ment able ible les led ious ant "
                    + "ary iety ist ism ial ate act ure iac ice aint ent ant ure ide ify les";

    private static final String CONSONANT_SUFFIXES =
            "cked cker tor ter ly rer tic nst lyst onic ght nge nce zer cy ly "
                    + "ny lic dged red ate ndle ching tching lent ged zen ted nnial lic "
                    + "rly stic se les";

    private static final String T_SUFFIXES = "ion ity ient ment ance ly less ter tor";

    // Doubled letters that read badly, and what replaces them
    private static final List<String[]> CLEANUP = List.of(
            new String[]{"aa", "a"}, new String[]{"hh", "h"}, new String[]{"ii", "i"},
            new String[]{"jj", "j"}, new String[]{"kk", "k"}, new String[]{"qq", "qu"},
            new String[]{"uu", "u"}, new String[]{"vv", "v"}, new String[]{"ww", "w"},
            new String[]{"xx", "x"}, new String[]{"yy", "y"}
    );

    private final WeightedRandom random;

    public PronounceableWordGenerator(WeightedRandom random) {
        this.random = random;
    }

    @Override
    public String nextWord() {
        StringBuilder word = new StringBuilder();
        boolean vowelNext = random.rand(1) == 1;
        int syllables = random.rand(5, 4);

        for (int i = 0; i < syllables; i++) {
            int length = word.length();

            if (vowelNext) {
                if (random.rand(3) == 0 && length > 1) {
                    word.append(random.pickOne(VOWEL_SUFFIXES));
                    break;
                }
                word.append(random.pickOne(CharacterSets.VOWELS2, 2));
            } else {
                if (random.rand(3) == 0 && length > 0) {
                    word.append(random.pickOne(CONSONANT_SUFFIXES));
                    break;
                }

                if (random.rand(3) == 0 && length > 0) {
                    word.append(random.pickOne(CharacterSets.CONSONANTS3));
                } else {
                    word.append(random.pickOne(CharacterSets.CONSONANTS2, 2));
                }

                if (word.charAt(word.length() - 1) == 't' && random.rand(2) == 0 && length > 1) {
                    word.append(random.pickOne(T_SUFFIXES));
                    break;
                }
            }

            vowelNext = !vowelNext;
        }

        return tidy(word.toString());
    }

    private static String tidy(String word) {
        String result = word;
        for (String[] pair : CLEANUP) {
            result = result.replace(pair[0], pair[1]);
        }
        // i before e except after c
        result = result.replace("cie", "cei");

        if (result.length() >= 2 && result.charAt(0) == result.charAt(1)) {
            result = result.substring(1);
        }
        return result;
    }
}
