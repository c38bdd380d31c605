package com.passpattern.generator.wordlist;

/**
 * Raised when a named word list does not exist.
 */
public class WordListNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;
    private final String listName;

    public WordListNotFoundException(String listName, String location) {
        super("Word list not found: " + listName + " (" + location + ")");
        this.listName = listName;
    }

    public String getListName() {
        return listName;
    }
}
