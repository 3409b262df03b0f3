package com.rfqlog.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads the YAML application configuration from the classpath into a Vert.x config object
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "application.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    public static JsonObject load() {
        return load(DEFAULT_RESOURCE);
    }

    public static JsonObject load(String resource) {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }

            Map<String, Object> values = YAML.readValue(is, new TypeReference<Map<String, Object>>() {});
            JsonObject config = values == null ? new JsonObject() : new JsonObject(values);

            if (!config.containsKey("database")) {
                throw new IllegalStateException(resource + " must contain a database section");
            }

            log.info("Loaded configuration from {}", resource);
            return config;

        } catch (IOException e) {
            log.error("Failed to load {}: {}", resource, e.getMessage());
            throw new IllegalStateException("Configuration error: " + resource + " could not be read", e);
        }
    }
}
