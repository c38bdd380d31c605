package com.passpattern.generator.text;

/**
 * Spells a number written in digits as words.
 */
@FunctionalInterface
public interface NumberToWords {

    /**
     * @param number digits, optionally signed, with optional thousands commas and decimal part
     * @return the spelled-out number, or an error phrase when {@code number} is not numeric
     */
    String toWords(String number);
}
