package com.passpattern.generator.placeholder;

import com.passpattern.generator.modifier.TextTransforms;
import com.passpattern.generator.random.WeightedRandom;

/**
 * Short codes that look like PINs or reference numbers: "44-7", "3.339", "(58)1".
 */
public class NumberCodeGenerator {

    private static final String DELIMITERS = "- - - - - - - - . . . , / \\ :";

    private final WeightedRandom random;
    private final TextTransforms transforms;

    public NumberCodeGenerator(WeightedRandom random, TextTransforms transforms) {
        this.random = random;
        this.transforms = transforms;
    }

    public String generate() {
        String repeatDigit = String.valueOf(random.rand(9, 0));
        String delimiter = random.pickOne(DELIMITERS);

        String code = "";
        while (true) {
            String digit = String.valueOf(random.rand(9, 0));

            while (true) {
                code += digit;
                if (random.chance(30)) {
                    code += repeatDigit;
                } else if (random.chance(40)) {
                    code += delimiter;
                }

                if (code.length() > 2 || !random.chance(30)) {
                    break;
                }
            }

            if (code.length() > random.rand(4, 3)) {
                break;
            }
            if (random.chance(10)) {
                code = transforms.bracket(code, "");
            }
            if (random.chance(15) && code.length() > 2) {
                break;
            }
        }

        if (!code.isEmpty() && !Character.isDigit(code.charAt(code.length() - 1))) {
            code = code.substring(0, code.length() - 1);
        }
        return code;
    }
}
