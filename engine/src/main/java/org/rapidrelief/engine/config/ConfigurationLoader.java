package org.rapidrelief.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.rapidrelief.engine.domain.exception.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * Reads YAML (or JSON) configuration documents from the filesystem or the classpath.
 * A location starting with {@code classpath:} is resolved against the class loader;
 * anything else is a file path.
 */
public final class ConfigurationLoader {

    private static final Logger LOG = Logger.getLogger(ConfigurationLoader.class.getName());

    public static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper mapper;

    public ConfigurationLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads a document and returns its root node.
     *
     * @throws ConfigurationException if the document is missing, unreadable, malformed or empty
     */
    public JsonNode load(String location) {
        if (location == null || location.trim().isEmpty()) {
            throw new ConfigurationException("Configuration location must not be empty");
        }
        String trimmed = location.trim();
        JsonNode root;
        try {
            if (trimmed.startsWith(CLASSPATH_PREFIX)) {
                root = loadFromClasspath(trimmed.substring(CLASSPATH_PREFIX.length()));
            } else {
                root = loadFromFile(Paths.get(trimmed));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration document " + trimmed + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull() || root.size() == 0) {
            throw new ConfigurationException("Configuration document " + trimmed + " is empty");
        }
        LOG.fine(() -> "Loaded configuration document " + trimmed);
        return root;
    }

    private JsonNode loadFromClasspath(String resource) throws IOException {
        String normalized = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigurationLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(normalized)) {
            if (in == null) {
                throw new ConfigurationException("Classpath resource not found: " + normalized);
            }
            return mapper.readTree(in);
        }
    }

    private JsonNode loadFromFile(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readTree(in);
        }
    }
}
