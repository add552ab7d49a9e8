package fr.lapetina.codex.linker.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from an arbitrary input stream
 * - Empty documents, which yield the defaults
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG = "linker.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(LinkerConfig.class, loaderOptions));
    }

    public ConfigLoader() {
        this(DEFAULT_CONFIG);
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public LinkerConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.debug("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private LinkerConfig loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            log.debug("Loading configuration from file: {}", path);
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public LinkerConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private LinkerConfig parse(InputStream is, String source) {
        try {
            LinkerConfig config = yaml.load(is);
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static LinkerConfig createDefault() {
        return new LinkerConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
