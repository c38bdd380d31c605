package com.passpattern.generator.text;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic text helpers shared by placeholders and modifiers.
 */
@UtilityClass
public class TextFormats {

    private static final String[] NATO = {
            "Alpha", "Bravo", "Charlie", "Delta", "Echo", "Foxtrot", "Golf", "Hotel", "India", "Juliet",
            "Kilo", "Lima", "Mike", "November", "Oscar", "Papa", "Quebec", "Romeo", "Sierra", "Tango",
            "Uniform", "Victor", "Whiskey", "X-Ray", "Yankee", "Zulu"
    };

    private static final String[] ALTERNATE_PHONETIC = {
            "Adam", "Baker", "Charles", "David", "Edward", "Frank", "George", "Henry", "Ida", "John",
            "King", "Lincoln", "Mary", "Nora", "Ocean", "Paul", "Queen", "Robert", "Sam", "Tom",
            "Union", "Victor", "William", "X-Ray", "Young", "Zebra"
    };

    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_NUMERALS = {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};

    /**
     * First character upper case, the rest lower case.
     */
    public static String sentenceCase(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1).toLowerCase(Locale.ROOT);
    }

    /**
     * Upper-cases every letter that follows a non-letter and lower-cases the others.
     */
    public static String titleCase(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                sb.append(c);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }

    /**
     * Number plus its English ordinal suffix. 11, 12 and 13 always take "th".
     */
    public static String ordinal(int number) {
        String n = String.valueOf(number);
        String lastTwo = n.length() >= 2 ? n.substring(n.length() - 2) : n;
        if (lastTwo.equals("11") || lastTwo.equals("12") || lastTwo.equals("13")) {
            return n + "th";
        }
        return switch (n.charAt(n.length() - 1)) {
            case '1' -> n + "st";
            case '2' -> n + "nd";
            case '3' -> n + "rd";
            default -> n + "th";
        };
    }

    /**
     * Spells the letters of {@code word} with a phonetic alphabet; non-letters are dropped.
     *
     * @param style 0 or 1 for the NATO alphabet, anything else for the older alternate alphabet
     */
    public static String phonetic(String word, int style) {
        String[] alphabet = (style == 0 || style == 1) ? NATO : ALTERNATE_PHONETIC;
        List<String> spelled = new ArrayList<>();
        for (char c : word.toUpperCase(Locale.ROOT).toCharArray()) {
            int index = c - 'A';
            if (index >= 0 && index < 26) {
                spelled.add(alphabet[index]);
            }
        }
        return String.join(" ", spelled);
    }

    /**
     * Subtractive-notation Roman numeral; zero and negative numbers give an empty string.
     */
    public static String toRoman(int number) {
        if (number <= 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        int remaining = number;
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (remaining >= ROMAN_VALUES[i]) {
                sb.append(ROMAN_NUMERALS[i]);
                remaining -= ROMAN_VALUES[i];
            }
        }
        return sb.toString();
    }

    /**
     * Left-pads with zeros to {@code width}, keeping a leading sign in front.
     */
    public static String zeroFill(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        String padding = "0".repeat(width - text.length());
        if (!text.isEmpty() && (text.charAt(0) == '-' || text.charAt(0) == '+')) {
            return text.charAt(0) + padding + text.substring(1);
        }
        return padding + text;
    }
}
