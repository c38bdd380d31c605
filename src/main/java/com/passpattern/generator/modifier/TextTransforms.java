package com.passpattern.generator.modifier;

import com.passpattern.generator.placeholder.CharacterSets;
import com.passpattern.generator.random.WeightedRandom;
import com.passpattern.generator.text.TextFormats;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The stochastic text transforms behind the modifier pipeline.
 */
public class TextTransforms {

    static final String DEFAULT_BRACKETS =
            "[ ] < > ( ) ( ) ( ) ( ) ( ) ( ) ( ) ( ) [ ] [ ] | | \\ / * * [ ] { } / / \\ / / \\ \\ \\ <- -> -> <-";

    private final WeightedRandom random;

    public TextTransforms(WeightedRandom random) {
        this.random = random;
    }

    /**
     * Wraps {@code word} in one pair drawn from a space-separated list of opening/closing tokens.
     * A blank list selects the default pairs.
     */
    public String bracket(String word, String pairs) {
        String list = (pairs == null || pairs.isEmpty()) ? DEFAULT_BRACKETS : pairs;
        String[] tokens = list.split(" ", -1);
        if (tokens.length < 2) {
            return word;
        }
        int pairIndex = random.index(tokens.length / 2);
        int x = pairIndex * 2;
        return tokens[x] + word + tokens[x + 1];
    }

    /**
     * Applies between 2 and 20 leet-speak substitutions, each replacing only the first match.
     * From the third draw on, once the word has changed, there is a 75% chance to stop early.
     */
    public String obscure(String word) {
        String result = word;
        int maxAttempts = random.rand(20, 2, 2);
        List<ObscureRules.Rule> rules = ObscureRules.RULES;

        for (int i = 0; i < maxAttempts; i++) {
            ObscureRules.Rule rule = rules.get(random.index(rules.size()));
            int at = result.indexOf(rule.getPattern());
            if (at >= 0) {
                result = result.substring(0, at) + rule.getReplacement()
                        + result.substring(at + rule.getPattern().length());
            }

            if (i >= 2 && !result.equals(word) && random.chance(75)) {
                break;
            }
        }
        return result;
    }

    /**
     * One of fifteen capitalisation strategies, chosen uniformly.
     */
    public String randomCase(String word) {
        if (word.isEmpty()) {
            return word;
        }
        int choice = random.rand(14, 0);
        int length = word.length();

        switch (choice) {
            case 0:
                return word;
            case 1:
                return word.toUpperCase(Locale.ROOT);
            case 2:
                return word.toLowerCase(Locale.ROOT);
            case 3:
                return TextFormats.titleCase(word);
            case 4: {
                char letter = word.charAt(random.index(length));
                return word.replace(letter, Character.toUpperCase(letter));
            }
            case 5: {
                StringBuilder sb = new StringBuilder(length);
                for (char c : word.toCharArray()) {
                    sb.append(random.rand(1) == 1 ? Character.toUpperCase(c) : c);
                }
                return sb.toString();
            }
            case 6:
            case 7:
                return upperRange(word, random.index(length), 1);
            case 8:
                return upperWhere(word, CharacterSets.VOWELS);
            case 9:
                return upperWhere(word, CharacterSets.CONSONANTS);
            case 10:
                if (length < 2) {
                    return word.toUpperCase(Locale.ROOT);
                }
                return upperRange(word, random.index(length - 1), 2);
            case 11:
                return upperRange(word, length - 1, 1);
            case 12:
                if (length >= 2) {
                    return upperRange(upperRange(word, 0, 1), length - 1, 1);
                }
                return word.toUpperCase(Locale.ROOT);
            case 13:
                return upperRange(word, 0, random.rand(length, 1, 2));
            default: {
                StringBuilder sb = new StringBuilder(length);
                for (int i = 0; i < length; i++) {
                    char c = word.charAt(i);
                    sb.append(i % 2 == 0 ? Character.toUpperCase(c) : c);
                }
                return sb.toString();
            }
        }
    }

    /**
     * Performs {@code times} random pairwise swaps. Length and character multiset are preserved.
     */
    public String scramble(String word, int times) {
        if (word.length() < 2) {
            return word;
        }
        char[] chars = word.toCharArray();
        for (int i = 0; i < times; i++) {
            int x1 = random.index(chars.length);
            int x2 = random.index(chars.length);
            char tmp = chars[x1];
            chars[x1] = chars[x2];
            chars[x2] = tmp;
        }
        return new String(chars);
    }

    /**
     * Per space-separated word: vowel-led words get "yay", others move their first letter to the
     * end and get "ay". A capitalised word yields a capitalised result.
     */
    public String pigLatin(String text) {
        String[] words = text.split(" ", -1);
        List<String> result = new ArrayList<>(words.length);

        for (String word : words) {
            if (word.isEmpty()) {
                result.add(word);
                continue;
            }

            char first = word.charAt(0);
            String converted;
            if ("aeiou".indexOf(Character.toLowerCase(first)) >= 0) {
                converted = word + "yay";
            } else {
                converted = word.substring(1) + first + "ay";
            }

            if (Character.isUpperCase(first)) {
                converted = converted.substring(0, 1).toUpperCase(Locale.ROOT) + converted.substring(1).toLowerCase(Locale.ROOT);
            }
            result.add(converted);
        }
        return String.join(" ", result);
    }

    /**
     * Swaps the first letters of the first two space-separated words.
     */
    public String swapInitials(String text) {
        String[] words = text.split(" ", -1);
        if (words.length < 2 || words[0].isEmpty() || words[1].isEmpty()) {
            return text;
        }
        char first = words[0].charAt(0);
        char second = words[1].charAt(0);
        words[0] = second + words[0].substring(1);
        words[1] = first + words[1].substring(1);
        return String.join(" ", words);
    }

    /**
     * Repeats the start of the word up to its first vowel ("he-he-hello"). One time in five the
     * stop set widens to some consonants. The prefix may gain an ellipsis (5%) or a space (10%)
     * and is prepended one to four times, fewer being likelier.
     */
    public String stutter(String word) {
        String marker = random.rand(100) > 20 ? "aeiou" : "hywrtnaeiou";

        for (int i = 0; i < word.length(); i++) {
            if (marker.indexOf(Character.toLowerCase(word.charAt(i))) < 0) {
                continue;
            }

            String firstPart = word.substring(0, i + 1);
            if (random.rand(100) < 5) {
                firstPart += "...";
            }
            if (random.rand(100) < 10) {
                firstPart += " ";
            }

            StringBuilder stuttered = new StringBuilder();
            int repeats = random.rand(4, 1, -2);
            for (int r = 0; r < repeats; r++) {
                stuttered.append(firstPart);
            }
            return stuttered.append(word).toString();
        }
        return word;
    }

    private static String upperRange(String word, int start, int count) {
        int end = Math.min(word.length(), start + count);
        if (start < 0 || start >= end) {
            return word;
        }
        return word.substring(0, start) + word.substring(start, end).toUpperCase(Locale.ROOT) + word.substring(end);
    }

    private static String upperWhere(String word, String letters) {
        StringBuilder sb = new StringBuilder(word.length());
        for (char c : word.toCharArray()) {
            sb.append(letters.indexOf(Character.toLowerCase(c)) >= 0 ? Character.toUpperCase(c) : c);
        }
        return sb.toString();
    }
}
