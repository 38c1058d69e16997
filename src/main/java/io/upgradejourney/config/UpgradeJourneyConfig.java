package io.upgradejourney.config;

import io.upgradejourney.retry.RetryPolicy;
import io.upgradejourney.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static io.upgradejourney.config.Constants.*;

/**
 * Configuration for an upgrade journey run.
 * Loads configuration from application.yml with fallbacks to constants.
 * An external file named by {@code UPGRADE_JOURNEY_CONFIG_FILE} takes precedence over the classpath,
 * and {@code UPGRADE_JOURNEY_VERSIONS} overrides the version list.
 */
@Slf4j
@Getter
public class UpgradeJourneyConfig {

    private final List<String> versions;
    private final String serviceEndpoint;
    private final String serviceImage;
    private final int httpBasePort;
    private final String className;
    private final Duration requestTimeout;
    private final int clusterSize;
    private final String networkAliasPrefix;
    private final Path dataDir;
    private final Duration startupTimeout;
    private final RetryPolicy readinessPolicy;
    private final RetryPolicy visibilityPolicy;

    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";

    /**
     * Build from a parsed model. Missing values fall back to {@link Constants}.
     *
     * @param config parsed YAML model
     * @param versionOverride versions to use instead of the configured list, ignored when empty
     */
    public UpgradeJourneyConfig(ConfigModel config, List<String> versionOverride) {
        Service service = config.getService() != null ? config.getService() : new Service();
        Cluster cluster = config.getCluster() != null ? config.getCluster() : new Cluster();

        this.versions = parseVersions(config, versionOverride);
        this.serviceEndpoint = valueOr(service.getEndpoint(), DEFAULT_SERVICE_ENDPOINT);
        this.serviceImage = valueOr(service.getImage(), DEFAULT_SERVICE_IMAGE);
        this.httpBasePort = valueOr(service.getHttp_base_port(), DEFAULT_HTTP_BASE_PORT);
        this.className = valueOr(service.getClass_name(), DEFAULT_CLASS_NAME);
        this.requestTimeout = Duration.ofSeconds(valueOr(service.getRequest_timeout_seconds(), DEFAULT_REQUEST_TIMEOUT_SECONDS));
        this.clusterSize = parseClusterSize(cluster);
        this.networkAliasPrefix = valueOr(cluster.getNetwork_alias_prefix(), DEFAULT_NETWORK_ALIAS_PREFIX);
        this.dataDir = Paths.get(valueOr(cluster.getData_dir(), DEFAULT_DATA_DIR));
        this.startupTimeout = Duration.ofSeconds(valueOr(cluster.getStartup_timeout_seconds(), DEFAULT_STARTUP_TIMEOUT_SECONDS));
        this.readinessPolicy = parseReadinessPolicy(config.getReadiness());
        this.visibilityPolicy = parseVisibilityPolicy(config.getVisibility());

        log.info("Loaded upgrade journey config - endpoint: {}, image: {}, cluster size: {}, {} versions",
                serviceEndpoint, serviceImage, clusterSize, versions.size());
    }

    /**
     * Load from the external file, else the classpath, applying environment overrides.
     */
    public static UpgradeJourneyConfig load() {
        return load(EnvironmentUtils.getEnv(ENV_CONFIG_FILE, null), DEFAULT_CONFIG_FILE_CLASSPATH,
                EnvironmentUtils.getEnvList(ENV_VERSIONS));
    }

    static UpgradeJourneyConfig load(String externalConfigPath, String classpathResource, List<String> versionOverride) {
        return new UpgradeJourneyConfig(loadYamlConfig(externalConfigPath, classpathResource), versionOverride);
    }

    public static ConfigModel parse(InputStream inputStream) {
        // application.yml also carries Spring's own keys; an explicitly set PropertyUtils survives new Yaml(...)
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        Constructor constructor = new Constructor(ConfigModel.class, new LoaderOptions());
        constructor.setPropertyUtils(propertyUtils);
        ConfigModel config = new Yaml(constructor).load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private static ConfigModel loadYamlConfig(String externalConfigPath, String classpathResource) {
        if (externalConfigPath != null && !externalConfigPath.isEmpty()) {
            log.info("External config file path specified via {}: {}", ENV_CONFIG_FILE, externalConfigPath);
            if (Files.exists(Paths.get(externalConfigPath))) {
                try (InputStream inputStream = new FileInputStream(externalConfigPath)) {
                    ConfigModel config = parse(inputStream);
                    log.info("Successfully loaded configuration from external file ({})", externalConfigPath);
                    return config;
                } catch (IOException e) {
                    log.warn("Error reading external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
                } catch (RuntimeException e) {
                    log.warn("Failed to parse external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
                }
            } else {
                log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", ENV_CONFIG_FILE);
        }

        try (InputStream inputStream = UpgradeJourneyConfig.class.getClassLoader().getResourceAsStream(classpathResource)) {
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
                return new ConfigModel();
            }
            ConfigModel config = parse(inputStream);
            log.info("Successfully loaded configuration from classpath ({})", classpathResource);
            return config;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load configuration from classpath ({}): {}. Using defaults.", classpathResource, e.getMessage());
            return new ConfigModel();
        }
    }

    private List<String> parseVersions(ConfigModel config, List<String> versionOverride) {
        if (versionOverride != null && !versionOverride.isEmpty()) {
            log.info("Using version list from {}: {}", ENV_VERSIONS, versionOverride);
            return List.copyOf(versionOverride);
        }
        // An explicitly empty list is kept so the run rejects it instead of silently using defaults
        if (config.getVersions() != null) {
            return List.copyOf(config.getVersions());
        }
        return DEFAULT_VERSIONS;
    }

    private int parseClusterSize(Cluster cluster) {
        int size = valueOr(cluster.getSize(), DEFAULT_CLUSTER_SIZE);
        if (size < 1) {
            log.warn("Invalid cluster size {}, using default {}", size, DEFAULT_CLUSTER_SIZE);
            return DEFAULT_CLUSTER_SIZE;
        }
        return size;
    }

    private RetryPolicy parseReadinessPolicy(Retry retry) {
        Retry r = retry != null ? retry : new Retry();
        return RetryPolicy.builder()
                .maxAttempts(valueOr(r.getMax_attempts(), DEFAULT_READINESS_MAX_ATTEMPTS))
                .interval(Duration.ofMillis(valueOr(r.getInterval_millis(), DEFAULT_READINESS_INTERVAL_MILLIS)))
                .backoffMultiplier(valueOr(r.getBackoff_multiplier(), DEFAULT_READINESS_BACKOFF_MULTIPLIER))
                .maxInterval(Duration.ofMillis(valueOr(r.getMax_interval_millis(), DEFAULT_READINESS_MAX_INTERVAL_MILLIS)))
                .build();
    }

    private RetryPolicy parseVisibilityPolicy(Retry retry) {
        Retry r = retry != null ? retry : new Retry();
        long interval = valueOr(r.getInterval_millis(), DEFAULT_VISIBILITY_INTERVAL_MILLIS);
        return RetryPolicy.builder()
                .maxAttempts(valueOr(r.getMax_attempts(), DEFAULT_VISIBILITY_MAX_ATTEMPTS))
                .interval(Duration.ofMillis(interval))
                .backoffMultiplier(valueOr(r.getBackoff_multiplier(), 1.0))
                .maxInterval(Duration.ofMillis(valueOr(r.getMax_interval_millis(), interval)))
                .build();
    }

    private static <T> T valueOr(T value, T defaultValue) {
        if (value instanceof String && ((String) value).isBlank()) {
            return defaultValue;
        }
        return value != null ? value : defaultValue;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Service service;
        private Cluster cluster;
        private Retry readiness;
        private Retry visibility;
        private List<String> versions;
    }

    @Data
    public static class Service {
        private String endpoint;
        private String image;
        private Integer http_base_port;
        private String class_name;
        private Long request_timeout_seconds;
    }

    @Data
    public static class Cluster {
        private Integer size;
        private String network_alias_prefix;
        private String data_dir;
        private Long startup_timeout_seconds;
    }

    @Data
    public static class Retry {
        private Integer max_attempts;
        private Long interval_millis;
        private Double backoff_multiplier;
        private Long max_interval_millis;
    }
}
