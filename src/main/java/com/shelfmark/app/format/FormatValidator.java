package com.shelfmark.app.format;

import java.io.IOException;

@FunctionalInterface
public interface FormatValidator {

    FormatValidator ACCEPT = source -> ValidationResult.valid();

    ValidationResult validate(ValidationSource source) throws IOException;
}
