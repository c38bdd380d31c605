package com.passpattern.generator.parser;

import com.passpattern.generator.model.ModifierSpec;
import com.passpattern.generator.model.PlaceholderContent;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits placeholder content into alternatives, or into a base name with parameters, qualifier
 * and modifier chain.
 *
 * <p>Grammar handled here (content only, braces already stripped):
 * <pre>
 * content      := alternatives | base ('+' modifier)*
 * alternatives := part ('|' part)+
 * base         := name ('(' paramlist ')')? ('[' INT ']')?
 * modifier     := name ('(' paramlist ')')? ('[' INT ']')?
 * </pre>
 * Separators nested inside parentheses are not split on. Only the first {@code [..]} and the first
 * {@code (..)} of each segment are honoured.
 */
public class PlaceholderContentParser {

    public PlaceholderContent parse(String content) {
        List<String> alternatives = splitTopLevel(content, '|');
        if (alternatives.size() > 1) {
            return PlaceholderContent.builder()
                    .raw(content)
                    .alternatives(List.copyOf(alternatives))
                    .build();
        }

        List<String> parts = splitTopLevel(content, '+');
        PlaceholderContent.PlaceholderContentBuilder builder = PlaceholderContent.builder().raw(content);

        for (int i = 1; i < parts.size(); i++) {
            builder.modifier(parseModifier(parts.get(i)));
        }

        Segment base = Segment.of(parts.get(0));
        return builder
                .name(base.name.trim())
                .params(base.params)
                .qualifier(base.qualifier)
                .build();
    }

    /**
     * Parses a single modifier specification such as {@code propercase[25]} or
     * {@code replace(" ","-")}.
     */
    public ModifierSpec parseModifier(String spec) {
        Segment segment = Segment.of(spec);
        return ModifierSpec.builder()
                .name(segment.name)
                .params(segment.params)
                .qualifier(segment.qualifier)
                .build();
    }

    /**
     * Splits on {@code separator} where it is not inside parentheses. An empty input yields a
     * single empty part.
     */
    static List<String> splitTopLevel(String content, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                depth--;
                current.append(c);
            } else if (c == separator && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }

        if (current.length() > 0) {
            parts.add(current.toString());
        }
        if (parts.isEmpty()) {
            parts.add(content);
        }
        return parts;
    }

    static List<String> splitParameters(String paramList) {
        List<String> params = new ArrayList<>();
        for (String param : paramList.split(",", -1)) {
            params.add(stripQuotes(param.trim()));
        }
        return params;
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * name + params + qualifier of one base or modifier segment.
     */
    private static final class Segment {
        private String name;
        private List<String> params = List.of();
        private Integer qualifier;

        static Segment of(String text) {
            Segment segment = new Segment();
            String remaining = text;

            int qualifierStart = remaining.indexOf('[');
            if (qualifierStart != -1) {
                int qualifierEnd = remaining.indexOf(']', qualifierStart);
                if (qualifierEnd != -1) {
                    segment.qualifier = parseQualifier(remaining.substring(qualifierStart + 1, qualifierEnd));
                    remaining = remaining.substring(0, qualifierStart) + remaining.substring(qualifierEnd + 1);
                }
            }

            segment.name = remaining;
            int paramStart = remaining.indexOf('(');
            if (paramStart != -1) {
                int paramEnd = remaining.indexOf(')', paramStart);
                if (paramEnd != -1) {
                    segment.name = remaining.substring(0, paramStart);
                    segment.params = splitParameters(remaining.substring(paramStart + 1, paramEnd));
                }
            }
            return segment;
        }

        private static Integer parseQualifier(String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
