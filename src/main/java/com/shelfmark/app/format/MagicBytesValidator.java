package com.shelfmark.app.format;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.io.IOUtils;

/**
 * Accepts files that start with a fixed signature.
 */
public final class MagicBytesValidator implements FormatValidator {

    private final String label;
    private final byte[] magic;

    public MagicBytesValidator(String label, String magic) {
        this.label = label;
        this.magic = magic.getBytes(StandardCharsets.ISO_8859_1);
    }

    @Override
    public ValidationResult validate(ValidationSource source) throws IOException {
        byte[] head = new byte[magic.length];
        int n;
        try (InputStream in = source.open()) {
            n = IOUtils.read(in, head);
        }
        if (n < magic.length || !Arrays.equals(head, magic)) {
            return ValidationResult.invalid("not a " + label + " file (bad signature)");
        }
        return ValidationResult.valid();
    }
}
