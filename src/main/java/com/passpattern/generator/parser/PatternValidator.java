package com.passpattern.generator.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural check callers run before accepting a pattern.
 *
 * <p>The resolver itself is lenient (an unmatched opening brace is emitted literally); this
 * validator is not. After escape sequences are applied it requires balanced brace, bracket and
 * parenthesis counts, and that no closing brace appears before its opening brace.
 */
public class PatternValidator {

    private final PatternEscaper escaper;

    public PatternValidator() {
        this(new PatternEscaper());
    }

    public PatternValidator(PatternEscaper escaper) {
        this.escaper = escaper;
    }

    /**
     * Returns every structural problem found; an empty list means the pattern is valid.
     */
    public List<String> check(String pattern) {
        List<String> errors = new ArrayList<>();
        if (pattern == null || pattern.isEmpty()) {
            errors.add("Empty pattern");
            return errors;
        }

        String escaped = escaper.escape(pattern);

        if (count(escaped, '{') != count(escaped, '}')) {
            errors.add("Unmatched braces in pattern");
        }
        if (count(escaped, '[') != count(escaped, ']')) {
            errors.add("Unmatched brackets in pattern");
        }
        if (count(escaped, '(') != count(escaped, ')')) {
            errors.add("Unmatched parentheses in pattern");
        }

        int depth = 0;
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    errors.add("Closing brace without opening brace at position " + i + ": " + pattern);
                    break;
                }
            }
        }

        return errors;
    }

    public boolean isValid(String pattern) {
        return check(pattern).isEmpty();
    }

    /**
     * Throws {@link PatternValidationException} listing every problem when the pattern is invalid.
     */
    public void validate(String pattern) {
        List<String> errors = check(pattern);
        if (!errors.isEmpty()) {
            throw new PatternValidationException(errors);
        }
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
