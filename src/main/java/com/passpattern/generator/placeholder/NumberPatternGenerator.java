package com.passpattern.generator.placeholder;

import com.passpattern.generator.model.ParameterList;
import com.passpattern.generator.random.WeightedRandom;
import com.passpattern.generator.text.TextFormats;

/**
 * Digit strings with memorable structure: repeats, runs up and runs down.
 */
public class NumberPatternGenerator {

    private final WeightedRandom random;

    public NumberPatternGenerator(WeightedRandom random) {
        this.random = random;
    }

    public String generate(int length) {
        if (length <= 0) {
            length = 3;
        }
        length = Math.min(length, ParameterList.MAX_COUNT);

        int[] digits = new int[length + 1];
        digits[1] = random.rand(9);

        for (int i = 2; i <= length; i++) {
            int previous = digits[i - 1];
            switch (random.rand(3, 0)) {
                case 0 -> digits[i] = random.rand(9);
                case 1 -> digits[i] = digits[random.rand(i - 1, 1)];
                case 2 -> digits[i] = previous > 1 ? previous - 1 : random.rand(9);
                default -> digits[i] = previous < 9 ? previous + 1 : random.rand(9);
            }
        }

        StringBuilder sb = new StringBuilder(length);
        for (int i = 1; i <= length; i++) {
            sb.append(digits[i]);
        }
        return TextFormats.zeroFill(sb.toString(), length);
    }
}
