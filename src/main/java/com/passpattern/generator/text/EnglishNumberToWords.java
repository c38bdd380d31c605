package com.passpattern.generator.text;

import java.util.regex.Pattern;

/**
 * English cardinal spelling in short scale up to the quadrillions, with "Minus"/"Plus" signs and
 * digit-by-digit decimals ("3.14" is "Three Point One Four").
 */
public class EnglishNumberToWords implements NumberToWords {

    static final String IMPROPER_NUMBER = "Error - Number improperly formed";
    static final String TOO_LARGE = "Error - Number too large";

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(?=[\\d,]*\\.?\\d)[\\d,]*(\\.\\d*)?");

    private static final String[] NUMBER_TEXT = {
            "Zero", "One", "Two", "Three", "Four", "Five", "Six", "Seven", "Eight", "Nine", "Ten",
            "Eleven", "Twelve", "Thirteen", "Fourteen", "Fifteen", "Sixteen", "Seventeen", "Eighteen",
            "Nineteen", "Twenty", "Thirty", "Forty", "Fifty", "Sixty", "Seventy", "Eighty", "Ninety"
    };

    @Override
    public String toWords(String number) {
        String text = number == null ? "" : number.trim();
        if (!NUMERIC.matcher(text).matches()) {
            return IMPROPER_NUMBER;
        }

        String sign = "";
        if (text.startsWith("-")) {
            sign = "Minus ";
            text = text.substring(1);
        } else if (text.startsWith("+")) {
            sign = "Plus ";
            text = text.substring(1);
        }

        String decimalPart = "";
        String wholePart;
        int point = text.indexOf('.');
        if (point >= 0) {
            wholePart = text.substring(0, point).replace(",", "");
            decimalPart = text.substring(point + 1);
        } else {
            wholePart = text.replace(",", "");
        }
        wholePart = stripLeadingZeros(wholePart);

        String bigWholePart = "";
        if (wholePart.length() > 9) {
            bigWholePart = wholePart.substring(0, wholePart.length() - 9);
            wholePart = wholePart.substring(wholePart.length() - 9);
        }
        if (bigWholePart.length() > 9) {
            return TOO_LARGE;
        }

        StringBuilder result = new StringBuilder();

        if (!bigWholePart.isEmpty()) {
            int value = Integer.parseInt(bigWholePart);
            if (value > 999_999) {
                int cardinal = value / 1_000_000;
                result.append(hundredsTensUnits(cardinal, false)).append("Quadrillion ");
                value -= cardinal * 1_000_000;
            }
            if (value > 999) {
                int cardinal = value / 1000;
                result.append(hundredsTensUnits(cardinal, false)).append("Trillion ");
                value -= cardinal * 1000;
            }
            if (value > 0) {
                result.append(hundredsTensUnits(value, false)).append("Billion ");
            }
        }

        int value = wholePart.isEmpty() ? 0 : Integer.parseInt(wholePart);
        if (value == 0 && bigWholePart.isEmpty()) {
            result.append("Zero ");
        }
        boolean large = value >= 100 || !bigWholePart.isEmpty();
        if (value > 999_999) {
            int cardinal = value / 1_000_000;
            result.append(hundredsTensUnits(cardinal, false)).append("Million ");
            value -= cardinal * 1_000_000;
        }
        if (value > 999) {
            int cardinal = value / 1000;
            result.append(hundredsTensUnits(cardinal, false)).append("Thousand ");
            value -= cardinal * 1000;
        }
        if (value > 0) {
            result.append(hundredsTensUnits(value, large));
        }

        if (!decimalPart.isEmpty()) {
            result.append("Point");
            for (char digit : decimalPart.toCharArray()) {
                if (Character.isDigit(digit)) {
                    result.append(' ').append(NUMBER_TEXT[digit - '0']);
                }
            }
        }

        return sign + result.toString().trim();
    }

    /**
     * Spells 0-999. With {@code useAnd} an "and" joins a non-zero tens/units part.
     */
    private static String hundredsTensUnits(int value, boolean useAnd) {
        StringBuilder sb = new StringBuilder();
        int remaining = value;

        if (remaining > 99) {
            int cardinal = remaining / 100;
            sb.append(NUMBER_TEXT[cardinal]).append(" Hundred ");
            remaining -= cardinal * 100;
        }
        if (useAnd && remaining > 0) {
            sb.append("and ");
        }
        if (remaining > 20) {
            int cardinal = remaining / 10;
            sb.append(NUMBER_TEXT[cardinal + 18]).append(' ');
            remaining -= cardinal * 10;
        }
        if (remaining > 0) {
            sb.append(NUMBER_TEXT[remaining]).append(' ');
        }
        return sb.toString();
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
