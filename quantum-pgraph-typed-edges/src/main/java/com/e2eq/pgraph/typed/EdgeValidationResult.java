package com.e2eq.pgraph.typed;

import java.util.Optional;

/**
 * Outcome of checking an edge against the catalog. {@code message} is null when valid.
 */
public record EdgeValidationResult(boolean valid, String message) {

    private static final EdgeValidationResult OK = new EdgeValidationResult(true, null);

    public static EdgeValidationResult ok() {
        return OK;
    }

    public static EdgeValidationResult failed(String message) {
        return new EdgeValidationResult(false, message);
    }

    public Optional<String> problem() {
        return Optional.ofNullable(message);
    }
}
