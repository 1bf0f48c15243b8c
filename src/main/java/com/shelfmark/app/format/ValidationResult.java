package com.shelfmark.app.format;

import java.util.List;

/**
 * Outcome of a format check. {@code missing} lists companion files a scene refers to but that
 * could not be found; it is empty for other failures.
 */
public record ValidationResult(boolean ok, String reason, List<String> missing) {

    private static final ValidationResult OK = new ValidationResult(true, null, List.of());

    public static ValidationResult valid() {
        return OK;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason, List.of());
    }

    public static ValidationResult missingCompanions(List<String> missing) {
        return new ValidationResult(false, "missing companion files: " + String.join(", ", missing), List.copyOf(missing));
    }
}
