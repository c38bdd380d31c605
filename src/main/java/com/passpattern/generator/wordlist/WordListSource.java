package com.passpattern.generator.wordlist;

/**
 * Supplies a random entry from a named word list.
 */
@FunctionalInterface
public interface WordListSource {

    /**
     * @param listName list name, with or without a {@code .txt} extension
     * @return one entry of the list, or an empty string when the list has no entries
     * @throws WordListNotFoundException when no list of that name exists
     */
    String lookupWord(String listName) throws WordListNotFoundException;
}
