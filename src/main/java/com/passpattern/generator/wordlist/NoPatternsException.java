package com.passpattern.generator.wordlist;

/**
 * Raised when a pattern is requested but none are configured.
 */
public class NoPatternsException extends Exception {

    private static final long serialVersionUID = 1L;

    public NoPatternsException(String message) {
        super(message);
    }

    public NoPatternsException(String message, Throwable cause) {
        super(message, cause);
    }
}
