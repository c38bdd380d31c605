package com.passpattern.generator.text;

/**
 * Supplies made-up words that can still be pronounced.
 */
@FunctionalInterface
public interface PronounceableWordSource {

    String nextWord();
}
