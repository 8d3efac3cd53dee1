package com.spectral.nsp.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spectral.nsp.api.NetworkValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link NetworkDefinition}s from JSON with Jackson.
 */
public final class JsonNetworkLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonNetworkLoader() {
        // Utility class
    }

    /** Parses a JSON file into a NetworkDefinition. */
    public static NetworkDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a JSON stream into a NetworkDefinition. Jackson closes the stream when done. */
    public static NetworkDefinition parse(InputStream in) throws IOException {
        return check(MAPPER.readValue(in, NetworkDefinition.class));
    }

    /**
     * Parses a JSON string into a NetworkDefinition.
     *
     * @throws NetworkValidationException on malformed JSON or a missing
     *                                    {@code network} key.
     */
    public static NetworkDefinition parse(String json) {
        try {
            return check(MAPPER.readValue(json, NetworkDefinition.class));
        } catch (JsonProcessingException e) {
            throw new NetworkValidationException("Malformed network definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Serializes a definition back to pretty-printed JSON. */
    public static String toJson(NetworkDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize network definition", e);
        }
    }

    private static NetworkDefinition check(NetworkDefinition def) {
        if (def == null || def.getNetwork() == null) {
            throw new NetworkValidationException("Missing 'network' key");
        }
        return def;
    }
}
