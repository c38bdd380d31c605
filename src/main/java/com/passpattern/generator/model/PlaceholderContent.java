package com.passpattern.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Parsed form of the text between a matching {@code {}} pair.
 *
 * <p>Either {@link #alternatives} is set and nothing else is, or the content is a base
 * placeholder: {@code name(params)[qualifier]} followed by zero or more modifiers.
 */
@Value
@Builder(toBuilder = true)
public class PlaceholderContent {

    /**
     * The raw content this was parsed from.
     */
    @NonNull
    String raw;

    /**
     * Placeholder name; empty for a literal grouping.
     */
    @NonNull
    @Builder.Default
    String name = "";

    @NonNull
    @Singular("param")
    List<String> params;

    /**
     * Percentage chance (0-100) that the placeholder produces a value; {@code null} means always.
     */
    Integer qualifier;

    @NonNull
    @Singular("modifier")
    List<ModifierSpec> modifiers;

    /**
     * Raw alternative sub-patterns, or {@code null} when the content is not an alternatives set.
     */
    List<String> alternatives;

    public boolean hasAlternatives() {
        return alternatives != null;
    }

    /**
     * A grouping placeholder resolves to its own content rather than a dispatched value.
     * It is signalled by an empty name or by content that starts with whitespace.
     */
    public boolean isLiteralGrouping() {
        return name.isEmpty() || raw.startsWith(" ") || raw.startsWith("\t");
    }

    public ParameterList parameters() {
        return new ParameterList(params);
    }
}
