package com.shelfmark.app.format;

/**
 * A file whose structure its format validator rejected.
 */
public class ValidationException extends Exception {

    private final transient ValidationResult result;

    public ValidationException(String name, ValidationResult result) {
        super(name + ": " + result.reason());
        this.result = result;
    }

    public ValidationResult result() {
        return result;
    }
}
