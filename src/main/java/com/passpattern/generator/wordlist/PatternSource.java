package com.passpattern.generator.wordlist;

/**
 * Supplies a pattern when the caller did not give one.
 */
@FunctionalInterface
public interface PatternSource {

    String randomPattern() throws NoPatternsException;
}
