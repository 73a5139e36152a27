package fmap.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Loads configuration with priority:
 * 1. System Properties
 * 2. Environment Variables
 * 3. External application.properties (via -Dconfig.dir system property or CONFIG_DIR)
 * 4. Classpath config/application.properties
 *
 * @since 14/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_FILE = "config/application.properties";

    private final Properties properties;

    public ConfigurationLoader() {
        this(DEFAULT_CONFIG_FILE);
    }

    public ConfigurationLoader(String configFile) {
        this.properties = loadProperties(configFile);
    }

    /**
     * Load properties with the following priority:
     * 1. Absolute file path (if provided)
     * 2. External file from the explicit config directory
     * 3. Classpath resource (in JAR)
     */
    private Properties loadProperties(String configFile) {
        Properties props = new Properties();

        Path configPath = Paths.get(configFile);
        if (configPath.isAbsolute() && Files.isRegularFile(configPath)) {
            if (loadFile(configPath, props)) {
                logger.info("Loaded configuration from absolute path: {}", configPath);
                return props;
            }
        }

        String configDir = System.getProperty("config.dir");
        if (configDir == null) {
            configDir = System.getenv("CONFIG_DIR");
        }
        if (configDir != null) {
            Path externalPath = Paths.get(configDir, "application.properties").normalize();
            if (Files.isRegularFile(externalPath) && loadFile(externalPath, props)) {
                logger.info("Loaded external configuration from: {}", externalPath.toAbsolutePath());
            } else {
                logger.warn("Config directory specified but file not found: {}", externalPath.toAbsolutePath());
            }
        }

        // Classpath values act as defaults for anything the external file left out
        Properties classpathProps = loadFromClasspath(configFile);
        for (String key : classpathProps.stringPropertyNames()) {
            props.putIfAbsent(key, classpathProps.getProperty(key));
        }

        if (props.isEmpty()) {
            logger.warn("No configuration file found, using built-in defaults only");
        }
        return props;
    }

    private boolean loadFile(Path path, Properties target) {
        try (InputStream input = Files.newInputStream(path)) {
            target.load(input);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to load configuration from '{}': {}", path, e.getMessage());
            return false;
        }
    }

    private Properties loadFromClasspath(String configFile) {
        Properties props = new Properties();
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (input != null) {
                props.load(input);
                logger.debug("Loaded classpath configuration from '{}'", configFile);
            }
        } catch (IOException e) {
            logger.debug("Error loading configuration from classpath '{}': {}", configFile, e.getMessage());
        }
        return props;
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from System Properties: {}", key, value);
            return value;
        }

        // mapping.color.tolerance -> MAPPING_COLOR_TOLERANCE
        String envKey = key.replace('.', '_').toUpperCase();
        value = System.getenv(envKey);
        if (value != null) {
            logger.debug("Property '{}' from Environment Variable '{}': {}", key, envKey, value);
            return value;
        }

        value = properties.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from configuration file: {}", key, value);
            return value;
        }

        logger.debug("Property '{}' not found, using default: {}", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }
}
