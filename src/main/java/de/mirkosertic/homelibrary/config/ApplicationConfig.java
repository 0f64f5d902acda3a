package de.mirkosertic.homelibrary.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the home library.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.homelibrary/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INDEX_PATH = "LIBRARY_INDEX_PATH";
    private static final String ENV_LOCALE = "LIBRARY_LOCALE";
    private static final String PROP_INDEX_PATH = "library.index.path";
    private static final String PROP_LOCALE = "library.locale";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".homelibrary";
    private static final String LOG_DIR = "log";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    public static final String INTERACTIVE_PROFILE = "interactive";

    // Index settings
    private String indexPath;

    // Collation settings
    private String collationLocale = "pl_PL";
    private String collationStrength = "tertiary";

    // Folding settings
    private boolean foldingCacheEnabled = true;

    // Profile settings
    private boolean interactiveMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: indexPath={}, locale={}, strength={}, foldingCache={}, interactive={}",
                config.indexPath, config.collationLocale, config.collationStrength,
                config.foldingCacheEnabled, config.interactiveMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> libraryConfig = (Map<String, Object>) config.get("library");
        if (libraryConfig == null) {
            return;
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) libraryConfig.get("index");
        if (indexConfig != null) {
            final Object path = indexConfig.get("path");
            if (path != null) {
                this.indexPath = resolveVariables(path.toString());
            }
        }

        final Map<String, Object> collationConfig = (Map<String, Object>) libraryConfig.get("collation");
        if (collationConfig != null) {
            if (collationConfig.containsKey("locale")) {
                this.collationLocale = collationConfig.get("locale").toString();
            }
            if (collationConfig.containsKey("strength")) {
                this.collationStrength = collationConfig.get("strength").toString();
            }
        }

        final Map<String, Object> foldingConfig = (Map<String, Object>) libraryConfig.get("folding");
        if (foldingConfig != null && foldingConfig.containsKey("cache-enabled")) {
            this.foldingCacheEnabled = (Boolean) foldingConfig.get("cache-enabled");
        }
    }

    private void applyEnvironmentOverrides() {
        // System properties first, so environment variables win
        final String propIndexPath = System.getProperty(PROP_INDEX_PATH);
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }

        final String propLocale = System.getProperty(PROP_LOCALE);
        if (propLocale != null && !propLocale.isEmpty()) {
            this.collationLocale = propLocale;
        }

        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        // Default index path if not set
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = getConfigDirectory().resolve("index").toString();
        }

        final String envLocale = System.getenv(ENV_LOCALE);
        if (envLocale != null && !envLocale.trim().isEmpty()) {
            this.collationLocale = envLocale.trim();
            logger.info("Collation locale from environment: {}", this.collationLocale);
        }
    }

    private void determineProfile() {
        this.interactiveMode = isInteractiveProfile();
    }

    /**
     * Whether the interactive profile is active. Readable before the configuration is loaded,
     * so logging can be set up first.
     */
    public static boolean isInteractiveProfile() {
        return INTERACTIVE_PROFILE.equalsIgnoreCase(System.getProperty(PROP_PROFILE, "default"));
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Where the interactive profile writes its log files.
     */
    public static Path getLogDirectory() {
        return getConfigDirectory().resolve(LOG_DIR);
    }

    // Getters
    public String getIndexPath() {
        return indexPath;
    }

    public String getCollationLocale() {
        return collationLocale;
    }

    public String getCollationStrength() {
        return collationStrength;
    }

    public boolean isFoldingCacheEnabled() {
        return foldingCacheEnabled;
    }

    public boolean isInteractiveMode() {
        return interactiveMode;
    }
}
