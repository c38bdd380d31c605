package com.passpattern.generator.generator;

import com.passpattern.generator.resolver.BackreferenceStore;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * What the owning {@link PasswordGenerator} did on its most recent call.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class GenerationSession {

    /**
     * Pattern of the last successful attempt.
     */
    private String lastPattern = "";

    /**
     * Password returned by the last successful attempt.
     */
    private String lastPassword = "";

    private BackreferenceStore backreferences = new BackreferenceStore();

    private int lastAttempts;

    private boolean usedFailsafe;

    /**
     * Replaces the backreference store for a new attempt and returns it.
     */
    BackreferenceStore beginAttempt() {
        backreferences = new BackreferenceStore();
        return backreferences;
    }
}
