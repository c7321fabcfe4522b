package de.mirkosertic.mcp.blobsearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the MCP Blob Search Server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpblobsearch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_BUCKET = "BLOBSEARCH_S3_BUCKET";
    private static final String ENV_REGION = "AWS_REGION";
    private static final String ENV_ENDPOINT = "BLOBSEARCH_S3_ENDPOINT";
    private static final String ENV_INDEX_PATH = "BLOBSEARCH_INDEX_PATH";
    private static final String ENV_MAX_FILE_SIZE_MB = "BLOBSEARCH_MAX_FILE_SIZE_MB";
    private static final String ENV_SUPPORTED_EXTENSIONS = "BLOBSEARCH_SUPPORTED_EXTENSIONS";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".mcpblobsearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    /** Upper bound for the worker count a caller may request for one batch. */
    public static final int HARD_MAX_CONCURRENCY = 20;

    // Store settings
    private String bucket = "";
    private String region = "us-east-1";
    private String endpoint = "";
    private boolean pathStyleAccess = false;
    private String prefix = "";
    private long urlTtlSeconds = 3600;

    // Index settings
    private String indexPath;
    private long nrtRefreshIntervalMs = 100;
    private int keyPageSize = 1000;

    // Processing settings
    private List<String> supportedExtensions = List.of(
            ".txt", ".csv", ".pdf", ".png", ".jpg", ".jpeg", ".docx", ".xlsx"
    );
    private long maxFileSizeMb = 100;
    private long maxContentLength = -1;
    private int defaultConcurrency = 5;
    private int maxConcurrency = HARD_MAX_CONCURRENCY;
    private int syncConcurrency = 3;

    // Profile settings
    private boolean deployedMode = false;

    ApplicationConfig() {
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
        config.clampLimits();

        logger.info("Configuration loaded: bucket={}, region={}, indexPath={}, maxFileSizeMb={}, deployedMode={}",
                config.bucket, config.region, config.indexPath, config.maxFileSizeMb, config.deployedMode);

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

    void applyYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> config = yaml.load(is);
        if (config != null) {
            applyYamlConfig(config);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("blobsearch");
        if (root == null) {
            return;
        }

        final Map<String, Object> storeConfig = (Map<String, Object>) root.get("store");
        if (storeConfig != null) {
            applyStoreConfig(storeConfig);
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            applyIndexConfig(indexConfig);
        }

        final Map<String, Object> processingConfig = (Map<String, Object>) root.get("processing");
        if (processingConfig != null) {
            applyProcessingConfig(processingConfig);
        }
    }

    private void applyStoreConfig(final Map<String, Object> storeConfig) {
        if (storeConfig.get("bucket") != null) {
            this.bucket = resolveVariables(storeConfig.get("bucket").toString());
        }
        if (storeConfig.get("region") != null) {
            this.region = resolveVariables(storeConfig.get("region").toString());
        }
        if (storeConfig.get("endpoint") != null) {
            this.endpoint = resolveVariables(storeConfig.get("endpoint").toString());
        }
        if (storeConfig.containsKey("path-style-access")) {
            this.pathStyleAccess = (Boolean) storeConfig.get("path-style-access");
        }
        if (storeConfig.get("prefix") != null) {
            this.prefix = resolveVariables(storeConfig.get("prefix").toString());
        }
        if (storeConfig.containsKey("url-ttl-seconds")) {
            this.urlTtlSeconds = ((Number) storeConfig.get("url-ttl-seconds")).longValue();
        }
    }

    private void applyIndexConfig(final Map<String, Object> indexConfig) {
        if (indexConfig.get("path") != null) {
            this.indexPath = resolveVariables(indexConfig.get("path").toString());
        }
        if (indexConfig.containsKey("nrt-refresh-interval-ms")) {
            this.nrtRefreshIntervalMs = ((Number) indexConfig.get("nrt-refresh-interval-ms")).longValue();
        }
        if (indexConfig.containsKey("key-page-size")) {
            this.keyPageSize = ((Number) indexConfig.get("key-page-size")).intValue();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyProcessingConfig(final Map<String, Object> processingConfig) {
        if (processingConfig.get("supported-extensions") instanceof List) {
            this.supportedExtensions = normalizeExtensions((List<String>) processingConfig.get("supported-extensions"));
        }
        if (processingConfig.containsKey("max-file-size-mb")) {
            this.maxFileSizeMb = ((Number) processingConfig.get("max-file-size-mb")).longValue();
        }
        if (processingConfig.containsKey("max-content-length")) {
            this.maxContentLength = ((Number) processingConfig.get("max-content-length")).longValue();
        }
        if (processingConfig.containsKey("default-concurrency")) {
            this.defaultConcurrency = ((Number) processingConfig.get("default-concurrency")).intValue();
        }
        if (processingConfig.containsKey("max-concurrency")) {
            this.maxConcurrency = ((Number) processingConfig.get("max-concurrency")).intValue();
        }
        if (processingConfig.containsKey("sync-concurrency")) {
            this.syncConcurrency = ((Number) processingConfig.get("sync-concurrency")).intValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envBucket = System.getenv(ENV_BUCKET);
        if (envBucket != null && !envBucket.isBlank()) {
            this.bucket = envBucket.trim();
        }

        final String envRegion = System.getenv(ENV_REGION);
        if (envRegion != null && !envRegion.isBlank()) {
            this.region = envRegion.trim();
        }

        final String envEndpoint = System.getenv(ENV_ENDPOINT);
        if (envEndpoint != null && !envEndpoint.isBlank()) {
            this.endpoint = envEndpoint.trim();
            logger.info("S3 endpoint from environment: {}", this.endpoint);
        }

        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.isBlank()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        final String envMaxSize = System.getenv(ENV_MAX_FILE_SIZE_MB);
        if (envMaxSize != null && !envMaxSize.isBlank()) {
            try {
                this.maxFileSizeMb = Long.parseLong(envMaxSize.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {} value: {}", ENV_MAX_FILE_SIZE_MB, envMaxSize);
            }
        }

        final String envExtensions = System.getenv(ENV_SUPPORTED_EXTENSIONS);
        if (envExtensions != null && !envExtensions.isBlank()) {
            this.supportedExtensions = normalizeExtensions(List.of(envExtensions.split(",")));
            logger.info("Supported extensions from environment: {}", this.supportedExtensions);
        }

        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "index").toString();
        }

        // System property for index path
        final String propIndexPath = System.getProperty("blobsearch.index.path");
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    void clampLimits() {
        if (maxConcurrency < 1 || maxConcurrency > HARD_MAX_CONCURRENCY) {
            logger.warn("max-concurrency {} out of range, using {}", maxConcurrency, HARD_MAX_CONCURRENCY);
            maxConcurrency = HARD_MAX_CONCURRENCY;
        }
        if (defaultConcurrency < 1 || defaultConcurrency > maxConcurrency) {
            logger.warn("default-concurrency {} out of range, using 5", defaultConcurrency);
            defaultConcurrency = Math.min(5, maxConcurrency);
        }
        if (syncConcurrency < 1 || syncConcurrency > maxConcurrency) {
            logger.warn("sync-concurrency {} out of range, using 3", syncConcurrency);
            syncConcurrency = Math.min(3, maxConcurrency);
        }
        if (keyPageSize < 1) {
            keyPageSize = 1000;
        }
    }

    static List<String> normalizeExtensions(final List<String> extensions) {
        final List<String> result = new ArrayList<>();
        for (final String extension : extensions) {
            if (extension == null) {
                continue;
            }
            String trimmed = extension.trim().toLowerCase(Locale.ROOT);
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!trimmed.startsWith(".")) {
                trimmed = "." + trimmed;
            }
            if (!result.contains(trimmed)) {
                result.add(trimmed);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
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

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getBucket() {
        return bucket;
    }

    public String getRegion() {
        return region;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public boolean isPathStyleAccess() {
        return pathStyleAccess;
    }

    public String getPrefix() {
        return prefix;
    }

    public Duration getUrlTtl() {
        return Duration.ofSeconds(urlTtlSeconds);
    }

    public String getIndexPath() {
        return indexPath;
    }

    public long getNrtRefreshIntervalMs() {
        return nrtRefreshIntervalMs;
    }

    public int getKeyPageSize() {
        return keyPageSize;
    }

    public List<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    public long getMaxFileSizeMb() {
        return maxFileSizeMb;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeMb * 1024 * 1024;
    }

    public long getMaxContentLength() {
        return maxContentLength;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getSyncConcurrency() {
        return syncConcurrency;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
