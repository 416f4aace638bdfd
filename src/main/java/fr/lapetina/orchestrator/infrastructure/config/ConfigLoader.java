package fr.lapetina.orchestrator.infrastructure.config;

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
import java.util.HashSet;
import java.util.Set;

/**
 * Loads the orchestrator configuration once at startup.
 *
 * Looks for the file on the file system first, then on the classpath.
 * The loaded configuration is validated before it is returned.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public OrchestratorConfig load() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return loadFromStream(is);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private OrchestratorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return loadFromStream(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        OrchestratorConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            config = createDefault();
        }
        validate(config);
        return config;
    }

    static void validate(OrchestratorConfig config) {
        Set<String> ids = new HashSet<>();
        for (OrchestratorConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigurationException("Provider without id");
            }
            if (!ids.add(provider.getId())) {
                throw new ConfigurationException("Duplicate provider id: " + provider.getId());
            }
        }
        if (config.getRetry().getMaxAttempts() < 1) {
            throw new ConfigurationException("retry.maxAttempts must be at least 1");
        }
        if (config.getCache().getMaxSize() < 1 || config.getCache().getTtlMs() <= 0) {
            throw new ConfigurationException("cache.maxSize and cache.ttlMs must be positive");
        }
        if (config.getHealthCheck().getWindowSize() < 1) {
            throw new ConfigurationException("healthCheck.windowSize must be at least 1");
        }
        if (config.getGateway().getBaseUrl() == null || config.getGateway().getBaseUrl().isBlank()) {
            throw new ConfigurationException("gateway.baseUrl is required");
        }
    }

    /**
     * Creates a default configuration.
     */
    public static OrchestratorConfig createDefault() {
        return new OrchestratorConfig();
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
