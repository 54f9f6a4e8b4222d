package de.mirkosertic.mcp.memoryindex.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the memory index server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.memoryindex/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INDEX_PATH = "MEMORYINDEX_INDEX_PATH";
    private static final String ENV_DATABASE_URL = "MEMORYINDEX_DATABASE_URL";
    private static final String PROP_INDEX_PATH = "memoryindex.index.path";
    private static final String PROP_DATABASE_URL = "memoryindex.database.url";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".memoryindex";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Storage settings
    private String indexPath;
    private String databaseUrl;
    private long nrtRefreshIntervalMs = 100;

    // Search settings
    private int snippetContextChars = 150;
    private int snippetFallbackChars = 300;
    private int fullContentMaxChars = 500;
    private double timelineWindowSeconds = 5.0;
    private int timelineProbeChars = 50;
    private int fuzzyMinLength = 3;
    private int fuzzyMaxLength = 8;
    private int candidateLimit = 10000;
    private int keywordThreads = 4;
    private Map<String, List<String>> categoryExpansions = new LinkedHashMap<>();

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: indexPath={}, databaseUrl={}, deployedMode={}",
                config.indexPath, config.databaseUrl, config.deployedMode);

        return config;
    }

    /**
     * Classpath defaults only, without user file or environment overrides. Paths still need to be set.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", userConfigPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    /**
     * Applies the {@code memoryindex} section of a YAML document on top of the current values.
     */
    void applyYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> config = yaml.load(is);
        if (config != null) {
            applyYamlConfig(config);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> rootConfig = (Map<String, Object>) config.get("memoryindex");
        if (rootConfig == null) {
            return;
        }

        final Map<String, Object> storageConfig = (Map<String, Object>) rootConfig.get("storage");
        if (storageConfig != null) {
            applyStorageConfig(storageConfig);
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) rootConfig.get("search");
        if (searchConfig != null) {
            applySearchConfig(searchConfig);
        }
    }

    private void applyStorageConfig(final Map<String, Object> storageConfig) {
        if (storageConfig.get("index-path") != null) {
            this.indexPath = resolveVariables(storageConfig.get("index-path").toString());
        }
        if (storageConfig.get("database-url") != null) {
            this.databaseUrl = resolveVariables(storageConfig.get("database-url").toString());
        }
        if (storageConfig.containsKey("nrt-refresh-interval-ms")) {
            this.nrtRefreshIntervalMs = ((Number) storageConfig.get("nrt-refresh-interval-ms")).longValue();
        }
    }

    @SuppressWarnings("unchecked")
    private void applySearchConfig(final Map<String, Object> searchConfig) {
        if (searchConfig.containsKey("snippet-context-chars")) {
            this.snippetContextChars = ((Number) searchConfig.get("snippet-context-chars")).intValue();
        }
        if (searchConfig.containsKey("snippet-fallback-chars")) {
            this.snippetFallbackChars = ((Number) searchConfig.get("snippet-fallback-chars")).intValue();
        }
        if (searchConfig.containsKey("full-content-max-chars")) {
            this.fullContentMaxChars = ((Number) searchConfig.get("full-content-max-chars")).intValue();
        }
        if (searchConfig.containsKey("timeline-window-seconds")) {
            this.timelineWindowSeconds = ((Number) searchConfig.get("timeline-window-seconds")).doubleValue();
        }
        if (searchConfig.containsKey("timeline-probe-chars")) {
            this.timelineProbeChars = ((Number) searchConfig.get("timeline-probe-chars")).intValue();
        }
        if (searchConfig.containsKey("fuzzy-min-length")) {
            this.fuzzyMinLength = ((Number) searchConfig.get("fuzzy-min-length")).intValue();
        }
        if (searchConfig.containsKey("fuzzy-max-length")) {
            this.fuzzyMaxLength = ((Number) searchConfig.get("fuzzy-max-length")).intValue();
        }
        if (searchConfig.containsKey("candidate-limit")) {
            this.candidateLimit = ((Number) searchConfig.get("candidate-limit")).intValue();
        }
        if (searchConfig.containsKey("keyword-threads")) {
            this.keywordThreads = ((Number) searchConfig.get("keyword-threads")).intValue();
        }
        if (searchConfig.get("category-expansions") instanceof Map<?, ?> expansions) {
            final Map<String, List<String>> parsed = new LinkedHashMap<>();
            for (final Map.Entry<?, ?> entry : expansions.entrySet()) {
                if (entry.getValue() instanceof List<?> patterns) {
                    final List<String> values = new ArrayList<>();
                    for (final Object pattern : patterns) {
                        values.add(String.valueOf(pattern));
                    }
                    parsed.put(String.valueOf(entry.getKey()).toLowerCase(Locale.ROOT), values);
                }
            }
            this.categoryExpansions = parsed;
        }
    }

    private void applyEnvironmentOverrides() {
        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        final String envDatabaseUrl = System.getenv(ENV_DATABASE_URL);
        if (envDatabaseUrl != null && !envDatabaseUrl.trim().isEmpty()) {
            this.databaseUrl = envDatabaseUrl.trim();
            logger.info("Database URL from environment: {}", this.databaseUrl);
        }

        final String propIndexPath = System.getProperty(PROP_INDEX_PATH);
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }

        final String propDatabaseUrl = System.getProperty(PROP_DATABASE_URL);
        if (propDatabaseUrl != null && !propDatabaseUrl.isEmpty()) {
            this.databaseUrl = propDatabaseUrl;
        }

        // Defaults if nothing configured them
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = getConfigDirectory().resolve("index").toString();
        }
        if (this.databaseUrl == null || this.databaseUrl.isEmpty()) {
            this.databaseUrl = "jdbc:h2:file:" + getConfigDirectory().resolve("store");
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}. Defaults may themselves contain variables.
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        final int start = value.indexOf("${");
        final int end = findClosingBrace(value, start + 2);
        if (end < 0) {
            return value;
        }

        final String varExpr = value.substring(start + 2, end);
        final int separator = varExpr.indexOf(':');
        final String varName = separator >= 0 ? varExpr.substring(0, separator) : varExpr;
        final String defaultValue = separator >= 0 ? varExpr.substring(separator + 1) : "";

        // Check environment first, then system properties
        String replacement = System.getenv(varName);
        if (replacement == null || replacement.isEmpty()) {
            replacement = System.getProperty(varName, defaultValue);
        }
        replacement = resolveVariables(replacement);

        return value.substring(0, start) + replacement + resolveVariables(value.substring(end + 1));
    }

    private static int findClosingBrace(final String value, final int from) {
        int depth = 1;
        for (int i = from; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '{' && i > 0 && value.charAt(i - 1) == '$') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getIndexPath() {
        return indexPath;
    }

    public void setIndexPath(final String indexPath) {
        this.indexPath = indexPath;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public void setDatabaseUrl(final String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public long getNrtRefreshIntervalMs() {
        return nrtRefreshIntervalMs;
    }

    public int getSnippetContextChars() {
        return snippetContextChars;
    }

    public int getSnippetFallbackChars() {
        return snippetFallbackChars;
    }

    public int getFullContentMaxChars() {
        return fullContentMaxChars;
    }

    public double getTimelineWindowSeconds() {
        return timelineWindowSeconds;
    }

    public int getTimelineProbeChars() {
        return timelineProbeChars;
    }

    public int getFuzzyMinLength() {
        return fuzzyMinLength;
    }

    public int getFuzzyMaxLength() {
        return fuzzyMaxLength;
    }

    public int getCandidateLimit() {
        return candidateLimit;
    }

    public int getKeywordThreads() {
        return keywordThreads;
    }

    public void setKeywordThreads(final int keywordThreads) {
        this.keywordThreads = keywordThreads;
    }

    public Map<String, List<String>> getCategoryExpansions() {
        return categoryExpansions;
    }

    public void setCategoryExpansions(final Map<String, List<String>> categoryExpansions) {
        this.categoryExpansions = new LinkedHashMap<>(categoryExpansions);
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
