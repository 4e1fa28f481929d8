package com.control.cfs.io;

import com.control.cfs.api.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Reads {@link SystemDefinition}s from JSON with Jackson.
 */
public final class SystemDefinitionLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SystemDefinitionLoader() {
    }

    public static SystemDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, SystemDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed system definition: " + e.getOriginalMessage(), e);
        }
    }

    public static SystemDefinition load(Path path) {
        try {
            return MAPPER.readValue(path.toFile(), SystemDefinition.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load system definition from " + path, e);
        }
    }

    /** Loads a definition from the classpath. */
    public static SystemDefinition loadResource(String resource) {
        ClassLoader cl = SystemDefinitionLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null)
                throw new ConfigurationException("System definition not found on classpath: " + resource);
            return MAPPER.readValue(in, SystemDefinition.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load system definition " + resource, e);
        }
    }

    public static String toJson(SystemDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Cannot serialize system definition", e);
        }
    }
}
