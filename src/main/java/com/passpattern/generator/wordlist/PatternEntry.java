package com.passpattern.generator.wordlist;

import lombok.NonNull;
import lombok.Value;

/**
 * One line of {@code patterns.cfg}: an optional display name and the pattern itself.
 */
@Value
public class PatternEntry {
    @NonNull
    String name;

    @NonNull
    String pattern;
}
