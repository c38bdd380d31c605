package com.passpattern.generator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.function.UnaryOperator;

/**
 * Outcome of resolving a pattern fragment: either a value or the reason the attempt failed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolutionResult {

    String value;
    ResolutionError error;
    String errorMessage;

    public static ResolutionResult ok(String value) {
        return new ResolutionResult(value, null, null);
    }

    public static ResolutionResult failure(ResolutionError error, String errorMessage) {
        return new ResolutionResult(null, error, errorMessage);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Applies {@code mapper} to a successful value; failures pass through untouched.
     */
    public ResolutionResult map(UnaryOperator<String> mapper) {
        return isSuccess() ? ok(mapper.apply(value)) : this;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ok(" + value + ")" : error + ": " + errorMessage;
    }
}
