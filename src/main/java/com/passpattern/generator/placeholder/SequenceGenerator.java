package com.passpattern.generator.placeholder;

import com.passpattern.generator.model.ParameterList;
import com.passpattern.generator.random.WeightedRandom;

/**
 * Keyboard and alphabet runs such as "qwe", "4567", "qawsed" or "zmxn".
 *
 * <p>Every strategy wraps around its source row, so the result is always exactly the requested
 * length.
 */
public class SequenceGenerator {

    private static final String NUMBERS = CharacterSets.DIGITS;
    private static final String KEY1 = "qwertyuiop";
    private static final String KEY2 = "asdfghjkl";
    private static final String KEY3 = "zxcvbnm";
    private static final String KEY4 = "poiuytrewq";
    private static final String KEY5 = "lkjhgfdsa";
    private static final String KEY6 = "mnbvcxz";

    private static final String[] RUNS = {CharacterSets.ALPHABET, NUMBERS, KEY1, KEY2, KEY3, KEY4, KEY5, KEY6};

    private final WeightedRandom random;

    public SequenceGenerator(WeightedRandom random) {
        this.random = random;
    }

    public String generate(int length) {
        if (length <= 0) {
            length = 3;
        }
        length = Math.min(length, ParameterList.MAX_COUNT);

        int choice = random.rand(19);
        StringBuilder seq = new StringBuilder();

        if (choice >= 1 && choice <= 8) {
            String row = RUNS[choice - 1];
            int start = random.index(Math.max(1, row.length() - length + 1));
            seq.append(window(row, start, length));
        } else if (choice == 9 || choice == 10) {
            int i = random.rand(7, 1);
            int n = (length + 2) / 3;
            String[] rows = choice == 9 ? new String[]{KEY1, KEY2, KEY3} : new String[]{KEY3, KEY2, KEY1};
            while (seq.length() < length) {
                for (String row : rows) {
                    seq.append(window(row, i, n));
                }
                i += n;
            }
        } else if (choice >= 11 && choice <= 13) {
            interleave(seq, KEY1, KEY2, random.rand(8, 1), length);
        } else if (choice == 14) {
            interleave(seq, KEY1, NUMBERS, random.rand(9, 1), length);
        } else if (choice == 15 || choice == 16) {
            interleave(seq, KEY4, KEY5, random.rand(8, 1), length);
        } else if (choice == 17) {
            zigzag(seq, KEY1, random.rand(9, 1), length);
        } else if (choice == 18) {
            zigzag(seq, KEY2, random.rand(8, 1), length);
        } else {
            zigzag(seq, KEY3, random.rand(6, 1), length);
        }

        return seq.substring(0, length);
    }

    private static String window(String row, int start, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int k = 0; k < length; k++) {
            sb.append(row.charAt((start + k) % row.length()));
        }
        return sb.toString();
    }

    private static void interleave(StringBuilder seq, String first, String second, int start, int length) {
        int size = Math.min(first.length(), second.length());
        int i = start % size;
        while (seq.length() < length) {
            seq.append(first.charAt(i)).append(second.charAt(i));
            i = (i + 1) % size;
        }
    }

    // Outside-in pairs: first and last key, then second and second-to-last
    private static void zigzag(StringBuilder seq, String row, int start, int length) {
        int i = start % row.length();
        while (seq.length() < length) {
            seq.append(row.charAt(i)).append(row.charAt(row.length() - i - 1));
            i = (i + 1) % row.length();
        }
    }
}
