package io.upgradejourney;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.upgradejourney.client.HttpServiceClient;
import io.upgradejourney.client.ServiceClient;
import io.upgradejourney.cluster.ClusterController;
import io.upgradejourney.cluster.DockerNodeRuntime;
import io.upgradejourney.cluster.NodeRuntime;
import io.upgradejourney.cluster.RollingUpdateStrategy;
import io.upgradejourney.config.UpgradeJourneyConfig;
import io.upgradejourney.metrics.MetricsProvider;
import io.upgradejourney.retry.Retrier;
import io.upgradejourney.retry.Sleeper;
import io.upgradejourney.runner.RunCoordinator;
import io.upgradejourney.util.EnvironmentUtils;
import io.upgradejourney.verification.ConsistencyVerifier;
import io.upgradejourney.workload.WorkloadDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;

import static io.upgradejourney.config.Constants.DEFAULT_RUN_ID;
import static io.upgradejourney.config.Constants.ENV_RUN_ID;

/**
 * Main Spring Boot application class for the upgrade journey harness.
 *
 * Provisions a cluster of the service under test, walks it through the configured
 * versions with rolling updates and verifies previously written data after every step.
 * The process exits 0 when every step verified and non-zero on the first failure.
 */
@Slf4j
@SpringBootApplication
public class UpgradeJourneyApplication {

    public static void main(String[] args) {
        log.info("Starting Upgrade Journey");

        int exitCode;
        try {
            ConfigurableApplicationContext context = SpringApplication.run(UpgradeJourneyApplication.class, args);
            exitCode = SpringApplication.exit(context);
        } catch (Exception e) {
            log.error("Upgrade Journey aborted: {}", e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    @Bean
    public UpgradeJourneyConfig config() {
        UpgradeJourneyConfig config = UpgradeJourneyConfig.load();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry) {
        return new MetricsProvider(meterRegistry, EnvironmentUtils.getEnv(ENV_RUN_ID, DEFAULT_RUN_ID));
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public NodeRuntime nodeRuntime(UpgradeJourneyConfig config) {
        log.info("Initializing DockerNodeRuntime for {} nodes of {}", config.getClusterSize(), config.getServiceImage());
        return new DockerNodeRuntime(
            config.getServiceImage(),
            config.getNetworkAliasPrefix(),
            config.getHttpBasePort(),
            config.getDataDir(),
            config.getClusterSize(),
            config.getStartupTimeout()
        );
    }

    @Bean
    public ClusterController clusterController(UpgradeJourneyConfig config, NodeRuntime nodeRuntime,
                                               MetricsProvider metricsProvider, Sleeper sleeper) {
        log.info("Initializing ClusterController");
        Retrier readinessRetrier = new Retrier(config.getReadinessPolicy(), sleeper);
        RollingUpdateStrategy strategy = new RollingUpdateStrategy(nodeRuntime, readinessRetrier, metricsProvider);
        return new ClusterController(nodeRuntime, strategy, readinessRetrier, config.getClusterSize());
    }

    @Bean
    public ServiceClient serviceClient(UpgradeJourneyConfig config, ObjectMapper objectMapper) {
        log.info("Initializing HttpServiceClient for {}", config.getServiceEndpoint());
        return new HttpServiceClient(config.getServiceEndpoint(), objectMapper, config.getRequestTimeout());
    }

    @Bean
    public WorkloadDriver workloadDriver(UpgradeJourneyConfig config, ServiceClient serviceClient,
                                         MetricsProvider metricsProvider) {
        return new WorkloadDriver(serviceClient, config.getClassName(), metricsProvider);
    }

    @Bean
    public ConsistencyVerifier consistencyVerifier(UpgradeJourneyConfig config, ServiceClient serviceClient,
                                                   Sleeper sleeper) {
        return new ConsistencyVerifier(serviceClient, config.getClassName(),
            new Retrier(config.getVisibilityPolicy(), sleeper));
    }

    @Bean
    public RunCoordinator runCoordinator(ClusterController clusterController, WorkloadDriver workloadDriver,
                                         ConsistencyVerifier consistencyVerifier, MetricsProvider metricsProvider) {
        return new RunCoordinator(clusterController, workloadDriver, consistencyVerifier, metricsProvider);
    }

    @Bean
    public UpgradeJourneyRunner upgradeJourneyRunner(UpgradeJourneyConfig config, RunCoordinator runCoordinator) {
        return new UpgradeJourneyRunner(config, runCoordinator);
    }
}
