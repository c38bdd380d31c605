package com.passpattern.generator.resolver;

import com.passpattern.generator.model.ModifierSpec;
import com.passpattern.generator.model.ParameterList;
import com.passpattern.generator.model.PlaceholderContent;
import com.passpattern.generator.model.ResolutionError;
import com.passpattern.generator.model.ResolutionResult;
import com.passpattern.generator.modifier.ModifierPipeline;
import com.passpattern.generator.parser.PatternEscaper;
import com.passpattern.generator.parser.PlaceholderContentParser;
import com.passpattern.generator.placeholder.BuiltinValueDispatcher;
import com.passpattern.generator.random.WeightedRandom;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Expands every {@code {...}} placeholder of an escaped pattern, innermost first.
 *
 * <p>After a closing brace the resolver also honours a {@code [N]} qualifier and a chain of
 * {@code +modifier} links that apply to the whole placeholder. An opening brace without a partner
 * is copied as literal text.
 *
 * <p>Input and output are both in escaped form. Generated values are escaped before they are
 * spliced in, so reserved characters inside them are never read as syntax.
 *
 * <p>Each resolved placeholder is recorded in the {@link BackreferenceStore} with its final value,
 * after any trailing qualifier and modifiers. Backreference placeholders are not recorded.
 */
public class PatternResolver {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final String BACKREFERENCE_PREFIX = "$W";
    private static final Pattern INLINE_QUALIFIER = Pattern.compile("\\[\\d+\\]");
    private static final String MODIFIER_TERMINATORS = "+{ \t.";

    private final PlaceholderContentParser parser;
    private final BuiltinValueDispatcher dispatcher;
    private final ModifierPipeline modifiers;
    private final PatternEscaper escaper;
    private final WeightedRandom random;
    private final int maxDepth;

    public PatternResolver(PlaceholderContentParser parser,
                           BuiltinValueDispatcher dispatcher,
                           ModifierPipeline modifiers,
                           PatternEscaper escaper,
                           WeightedRandom random,
                           int maxDepth) {
        this.parser = parser;
        this.dispatcher = dispatcher;
        this.modifiers = modifiers;
        this.escaper = escaper;
        this.random = random;
        this.maxDepth = maxDepth;
    }

    /**
     * Resolves all placeholders of an already escaped pattern.
     *
     * @param escapedPattern pattern after {@link PatternEscaper#escape(String)}
     * @param store          receives one entry per resolved placeholder
     * @return the resolved text, still escaped, or the reason the attempt failed
     */
    public ResolutionResult resolve(String escapedPattern, BackreferenceStore store) {
        return process(escapedPattern, store, 0);
    }

    private ResolutionResult process(String pattern, BackreferenceStore store, int depth) {
        if (depth > maxDepth) {
            return ResolutionResult.failure(ResolutionError.TOO_DEEPLY_NESTED,
                    "Placeholders nested deeper than " + maxDepth + " levels");
        }

        StringBuilder result = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            int close = c == '{' ? matchingBrace(pattern, i) : -1;
            if (close < 0) {
                result.append(c);
                i++;
                continue;
            }

            ResolutionResult inner = process(pattern.substring(i + 1, close), store, depth + 1);
            if (inner.isFailure()) {
                return inner;
            }

            String content = inner.getValue();
            boolean backreference = content.startsWith(BACKREFERENCE_PREFIX);
            ResolutionResult resolved = backreference
                    ? ResolutionResult.ok(backreference(content, store))
                    : resolveContent(content, store, depth);
            if (resolved.isFailure()) {
                return resolved;
            }

            String value = resolved.getValue();
            int j = close + 1;

            // Qualifier on the closing brace: {word}[50]
            if (j < pattern.length() && pattern.charAt(j) == '[') {
                int qualifierEnd = pattern.indexOf(']', j);
                if (qualifierEnd != -1) {
                    Integer qualifier = parseInt(pattern.substring(j + 1, qualifierEnd));
                    if (qualifier != null && random.rand(99, 0) >= qualifier) {
                        value = "";
                    }
                    j = qualifierEnd + 1;
                }
            }

            // Modifiers on the closing brace: {word}+propercase+bracket
            while (j < pattern.length() && pattern.charAt(j) == '+') {
                int end = modifierEnd(pattern, j + 1);
                String spec = pattern.substring(j + 1, end);
                if (!spec.isEmpty()) {
                    ResolutionResult modified = applyTrailingModifier(value, parser.parseModifier(spec), store, depth);
                    if (modified.isFailure()) {
                        return modified;
                    }
                    value = modified.getValue();
                }
                j = end;
            }

            if (!backreference) {
                store.record(value);
            }
            result.append(value);
            i = j;
        }

        return ResolutionResult.ok(result.toString());
    }

    /**
     * Resolves the already expanded text between one pair of braces.
     */
    private ResolutionResult resolveContent(String content, BackreferenceStore store, int depth) {
        PlaceholderContent placeholder = parser.parse(content);

        if (placeholder.hasAlternatives()) {
            String choice = random.pickOne(placeholder.getAlternatives());
            if (choice.contains("{")) {
                return process(choice, store, depth + 1);
            }
            return ResolutionResult.ok(choice);
        }

        Integer qualifier = placeholder.getQualifier();
        if (qualifier != null && random.rand(99, 0) >= qualifier) {
            return ResolutionResult.ok("");
        }

        if (placeholder.isLiteralGrouping()) {
            return ResolutionResult.ok(INLINE_QUALIFIER.matcher(content).replaceAll(""));
        }

        ResolutionResult dispatched = dispatcher.dispatch(placeholder.getName(), placeholder.parameters());
        if (dispatched.isFailure()) {
            return dispatched;
        }

        String value = dispatched.getValue();
        for (ModifierSpec modifier : placeholder.getModifiers()) {
            if (modifier.getQualifier() != null && random.rand(99, 0) >= modifier.getQualifier()) {
                continue;
            }

            List<String> params = new ArrayList<>();
            for (String param : modifier.getParams()) {
                ResolutionResult expanded = expandParameter(param, store, depth);
                if (expanded.isFailure()) {
                    return expanded;
                }
                params.add(expanded.getValue());
            }

            ResolutionResult modified = modifiers.apply(value, modifier.getName(), new ParameterList(params));
            if (modified.isFailure()) {
                return modified;
            }
            value = modified.getValue();
        }

        return ResolutionResult.ok(escaper.escapeValue(value));
    }

    /**
     * Applies one {@code +modifier} link that follows a closing brace. The value is unescaped for
     * the modifier and escaped again afterwards.
     */
    private ResolutionResult applyTrailingModifier(String value, ModifierSpec modifier,
                                                   BackreferenceStore store, int depth) {
        List<String> params = new ArrayList<>();
        for (String param : modifier.getParams()) {
            ResolutionResult expanded = expandParameter(param, store, depth);
            if (expanded.isFailure()) {
                return expanded;
            }
            params.add(expanded.getValue());
        }

        Integer qualifier = modifier.getQualifier();
        if (qualifier != null && random.rand(99, 0) >= qualifier) {
            return ResolutionResult.ok(value);
        }

        return modifiers.apply(escaper.unescape(value), modifier.getName(), new ParameterList(params))
                .map(escaper::escapeValue);
    }

    // Parameters may hold placeholders of their own: replace("a","{symbol}")
    private ResolutionResult expandParameter(String param, BackreferenceStore store, int depth) {
        if (!param.contains("{")) {
            return ResolutionResult.ok(escaper.unescape(param));
        }
        return process(param, store, depth + 1).map(escaper::unescape);
    }

    private static String backreference(String content, BackreferenceStore store) {
        Integer key = parseInt(content.substring(BACKREFERENCE_PREFIX.length()));
        return key == null ? "" : store.valueOf(key);
    }

    /**
     * Index of the brace closing the one at {@code open}, or -1 when it is never closed.
     */
    static int matchingBrace(String pattern, int open) {
        int depth = 0;
        for (int k = open; k < pattern.length(); k++) {
            char c = pattern.charAt(k);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return k;
                }
            }
        }
        return -1;
    }

    /**
     * End of a trailing modifier: the first plus sign, opening brace, whitespace or period found
     * outside parentheses.
     */
    static int modifierEnd(String pattern, int start) {
        int parenDepth = 0;
        int k = start;
        while (k < pattern.length()) {
            char c = pattern.charAt(k);
            if (c == '(') {
                parenDepth++;
            } else if (c == ')') {
                parenDepth--;
            } else if (parenDepth == 0 && MODIFIER_TERMINATORS.indexOf(c) >= 0) {
                break;
            }
            k++;
        }
        return k;
    }

    private static Integer parseInt(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
