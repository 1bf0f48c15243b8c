package com.shelfmark.app.format;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A glTF scene is only usable with every external buffer and image it names. Embedded
 * {@code data:} URIs need nothing on disk.
 */
public final class GltfCompanionValidator implements FormatValidator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public ValidationResult validate(ValidationSource source) throws IOException {
        JsonNode root;
        try (InputStream in = source.open()) {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            return ValidationResult.invalid("invalid glTF JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ValidationResult.invalid("invalid glTF JSON: not an object");
        }

        List<String> missing = new ArrayList<>();
        for (String uri : externalUris(root)) {
            if (!source.hasCompanion(uri)) {
                missing.add(FilenameUtils.getName(uri.replace('\0', '?')));
            }
        }
        return missing.isEmpty() ? ValidationResult.valid() : ValidationResult.missingCompanions(missing);
    }

    static Set<String> externalUris(JsonNode root) {
        Set<String> uris = new LinkedHashSet<>();
        collect(root.path("buffers"), uris);
        collect(root.path("images"), uris);
        return uris;
    }

    // URIs are percent-encoded; '+' is a literal plus
    private static String decode(String uri) {
        try {
            return URLDecoder.decode(uri.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return uri;
        }
    }

    private static void collect(JsonNode array, Set<String> out) {
        if (!array.isArray()) return;
        for (JsonNode item : array) {
            String uri = item.path("uri").asText("");
            if (uri.isEmpty() || uri.startsWith("data:")) continue;
            out.add(decode(uri));
        }
    }
}
