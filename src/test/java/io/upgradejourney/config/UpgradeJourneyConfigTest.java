package io.upgradejourney.config;

import io.upgradejourney.config.UpgradeJourneyConfig.ConfigModel;
import io.upgradejourney.retry.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class UpgradeJourneyConfigTest {

    @Test
    void testParseTestConfiguration() throws Exception {
        UpgradeJourneyConfig config;
        try (InputStream in = getClass().getResourceAsStream("/upgrade-journey-test.yml")) {
            config = new UpgradeJourneyConfig(UpgradeJourneyConfig.parse(in), List.of());
        }

        assertThat(config.getServiceEndpoint()).isEqualTo("http://localhost:9090");
        assertThat(config.getClassName()).isEqualTo("JourneyTest");
        assertThat(config.getClusterSize()).isEqualTo(5);
        assertThat(config.getNetworkAliasPrefix()).isEqualTo("node-");
        assertThat(config.getVersions()).containsExactly("1.0", "1.1", "1.2");

        RetryPolicy readiness = config.getReadinessPolicy();
        assertThat(readiness.getMaxAttempts()).isEqualTo(7);
        assertThat(readiness.getInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(readiness.getBackoffMultiplier()).isEqualTo(2.0);
        assertThat(readiness.getMaxInterval()).isEqualTo(Duration.ofSeconds(1));

        // not in the file
        assertThat(config.getServiceImage()).isEqualTo(Constants.DEFAULT_SERVICE_IMAGE);
        assertThat(config.getVisibilityPolicy().getMaxAttempts()).isEqualTo(Constants.DEFAULT_VISIBILITY_MAX_ATTEMPTS);
    }

    @Test
    void testBundledApplicationYamlMatchesDefaults() throws Exception {
        UpgradeJourneyConfig config;
        try (InputStream in = getClass().getResourceAsStream("/application.yml")) {
            config = new UpgradeJourneyConfig(UpgradeJourneyConfig.parse(in), null);
        }

        assertThat(config.getVersions()).isEqualTo(Constants.DEFAULT_VERSIONS);
        assertThat(config.getServiceEndpoint()).isEqualTo(Constants.DEFAULT_SERVICE_ENDPOINT);
        assertThat(config.getClusterSize()).isEqualTo(Constants.DEFAULT_CLUSTER_SIZE);
        assertThat(config.getDataDir()).isEqualTo(Paths.get(Constants.DEFAULT_DATA_DIR));
        assertThat(config.getReadinessPolicy().getMaxAttempts()).isEqualTo(120);
        assertThat(config.getVisibilityPolicy().getInterval()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void testLoadReadsClasspathFileWithSpringKeys() {
        UpgradeJourneyConfig config = UpgradeJourneyConfig.load(null, "upgrade-journey-test.yml", List.of());

        assertThat(config.getClusterSize()).isEqualTo(5);
        assertThat(config.getClassName()).isEqualTo("JourneyTest");
        assertThat(config.getVersions()).containsExactly("1.0", "1.1", "1.2");
    }

    @Test
    void testLoadPrefersExternalFile(@TempDir Path dir) throws Exception {
        Path external = dir.resolve("journey.yml");
        Files.writeString(external, "spring:\n  main:\n    banner-mode: off\n"
            + "logging:\n  level:\n    root: WARN\n"
            + "service:\n  class_name: External\n"
            + "cluster:\n  size: 7\n"
            + "versions: [\"2.0\", \"2.1\"]\n");

        UpgradeJourneyConfig config = UpgradeJourneyConfig.load(external.toString(), "upgrade-journey-test.yml", List.of());

        assertThat(config.getClusterSize()).isEqualTo(7);
        assertThat(config.getClassName()).isEqualTo("External");
        assertThat(config.getVersions()).containsExactly("2.0", "2.1");
    }

    @Test
    void testLoadFallsBackToClasspathWhenExternalFileIsMissing(@TempDir Path dir) {
        UpgradeJourneyConfig config = UpgradeJourneyConfig.load(
            dir.resolve("missing.yml").toString(), "upgrade-journey-test.yml", List.of("3.0"));

        assertThat(config.getClusterSize()).isEqualTo(5);
        assertThat(config.getVersions()).containsExactly("3.0");
    }

    @Test
    void testLoadWithoutAnyFileUsesDefaults() {
        UpgradeJourneyConfig config = UpgradeJourneyConfig.load(null, "no-such-config.yml", List.of());

        assertThat(config.getVersions()).isEqualTo(Constants.DEFAULT_VERSIONS);
        assertThat(config.getClassName()).isEqualTo(Constants.DEFAULT_CLASS_NAME);
    }

    @Test
    void testLoadUsesBundledApplicationYaml() {
        UpgradeJourneyConfig config = UpgradeJourneyConfig.load();

        assertThat(config.getVersions()).isEqualTo(Constants.DEFAULT_VERSIONS);
        assertThat(config.getNetworkAliasPrefix()).isEqualTo("weaviate-node-");
    }

    @Test
    void testSpringKeysAreIgnored() {
        String yaml = "spring:\n  main:\n    web-application-type: none\n"
            + "logging:\n  level:\n    io.upgradejourney: DEBUG\n"
            + "cluster:\n  size: 4\n";

        ConfigModel model = UpgradeJourneyConfig.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertThat(model.getCluster().getSize()).isEqualTo(4);
    }

    @Test
    void testEmptyModelUsesDefaults() {
        UpgradeJourneyConfig config = new UpgradeJourneyConfig(new ConfigModel(), null);

        assertThat(config.getVersions()).isEqualTo(Constants.DEFAULT_VERSIONS);
        assertThat(config.getServiceImage()).isEqualTo("semitechnologies/weaviate");
        assertThat(config.getHttpBasePort()).isEqualTo(8080);
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getStartupTimeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(config.getVisibilityPolicy().getMaxInterval()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void testVersionOverrideWins() {
        ConfigModel model = new ConfigModel();
        model.setVersions(List.of("1.0", "1.1"));

        UpgradeJourneyConfig config = new UpgradeJourneyConfig(model, List.of("2.0", "2.1", "2.2"));

        assertThat(config.getVersions()).containsExactly("2.0", "2.1", "2.2");
    }

    @Test
    void testExplicitlyEmptyVersionListIsKept() {
        ConfigModel model = new ConfigModel();
        model.setVersions(List.of());

        UpgradeJourneyConfig config = new UpgradeJourneyConfig(model, List.of());

        assertThat(config.getVersions()).isEmpty();
    }

    @Test
    void testInvalidClusterSizeFallsBackToDefault() {
        ConfigModel model = new ConfigModel();
        UpgradeJourneyConfig.Cluster cluster = new UpgradeJourneyConfig.Cluster();
        cluster.setSize(0);
        model.setCluster(cluster);

        assertThat(new UpgradeJourneyConfig(model, null).getClusterSize()).isEqualTo(Constants.DEFAULT_CLUSTER_SIZE);
    }

    @Test
    void testBlankValuesFallBackToDefaults() {
        String yaml = "service:\n  endpoint: \"  \"\n  class_name: Books\n";
        ConfigModel model = UpgradeJourneyConfig.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        UpgradeJourneyConfig config = new UpgradeJourneyConfig(model, null);

        assertThat(config.getServiceEndpoint()).isEqualTo(Constants.DEFAULT_SERVICE_ENDPOINT);
        assertThat(config.getClassName()).isEqualTo("Books");
    }

    @Test
    void testEmptyDocumentParsesToEmptyModel() {
        ConfigModel model = UpgradeJourneyConfig.parse(new ByteArrayInputStream(new byte[0]));

        assertThat(model).isNotNull();
        assertThat(model.getVersions()).isNull();
    }
}
