package com.passpattern.generator.model;

/**
 * Reasons a single generation attempt can fail. Every one of them is retryable.
 */
public enum ResolutionError {
    /**
     * A modifier name that is not in the pipeline's table.
     */
    UNKNOWN_MODIFIER,

    /**
     * Placeholder nesting deeper than the configured limit.
     */
    TOO_DEEPLY_NESTED,

    /**
     * An explicit {@code {word(list)}} named a list that does not exist.
     */
    WORD_LIST_MISSING,

    /**
     * No pattern was given and the pattern source had none to offer.
     */
    NO_PATTERNS
}
