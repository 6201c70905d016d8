package com.slate.kernel.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@link ExpressionDefinition}s from JSON.
 */
public final class ExpressionLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExpressionLoader() {
        // Utility class
    }

    /** Parses a JSON file into an ExpressionDefinition. */
    public static ExpressionDefinition parseFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return validate(MAPPER.readValue(in, ExpressionDefinition.class), path.toString());
        }
    }

    /**
     * Parses a JSON string into an ExpressionDefinition.
     *
     * @throws IllegalArgumentException if the text is not a valid definition.
     */
    public static ExpressionDefinition parse(String json) {
        try {
            return validate(MAPPER.readValue(json, ExpressionDefinition.class), "<string>");
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed expression definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a classpath resource into an ExpressionDefinition. */
    public static ExpressionDefinition parseResource(String resource) throws IOException {
        try (InputStream in = ExpressionLoader.class.getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Missing classpath resource " + resource);
            return validate(MAPPER.readValue(in, ExpressionDefinition.class), resource);
        }
    }

    private static ExpressionDefinition validate(ExpressionDefinition def, String source) {
        if (def == null || def.getExpression() == null)
            throw new IllegalArgumentException("Missing 'expression' key in " + source);
        return def;
    }
}
