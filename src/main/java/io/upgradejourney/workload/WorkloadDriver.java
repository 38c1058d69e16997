package io.upgradejourney.workload;

import io.upgradejourney.client.ServiceClient;
import io.upgradejourney.exceptions.ImportException;
import io.upgradejourney.exceptions.SchemaException;
import io.upgradejourney.metrics.MetricsProvider;
import io.upgradejourney.models.ClassSchema;
import io.upgradejourney.models.PropertySchema;
import io.upgradejourney.models.RunState;
import io.upgradejourney.models.UpgradeRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

import static io.upgradejourney.metrics.MetricsConstants.OBJECTS_CREATED_METRIC_NAME;

/**
 * Creates the test class once and writes one version-tagged record per step.
 */
@Slf4j
public class WorkloadDriver {

    // "string" is the exact-match text type across every release line the harness targets
    static final String VERSION_DATA_TYPE = "string";
    static final String OBJECT_COUNT_DATA_TYPE = "int";

    private final ServiceClient client;
    private final String className;
    private final MetricsProvider metricsProvider;

    public WorkloadDriver(ServiceClient client, String className, MetricsProvider metricsProvider) {
        this.client = client;
        this.className = className;
        this.metricsProvider = metricsProvider;
    }

    public String getClassName() {
        return className;
    }

    /**
     * Define the test class. Expected to run once against a fresh cluster.
     *
     * @throws SchemaException if the service rejects the class, including when it already exists
     */
    public void createSchema() {
        ClassSchema schema = new ClassSchema(className, List.of(
            PropertySchema.of(UpgradeRecord.VERSION_PROPERTY, VERSION_DATA_TYPE),
            PropertySchema.of(UpgradeRecord.OBJECT_COUNT_PROPERTY, OBJECT_COUNT_DATA_TYPE)
        ));
        try {
            client.createClass(schema);
            log.info("Created class {}", className);
        } catch (Exception e) {
            log.error("Failed to create class {}: {}", className, e.getMessage(), e);
            throw new SchemaException("class " + className + " could not be created: " + e.getMessage(), e);
        }
    }

    /**
     * Write one record tagged with {@code version} and the current write counter.
     *
     * @return the run state with the write counted
     * @throws ImportException if the service rejects the write
     */
    public RunState importForVersion(RunState state, String version) {
        UpgradeRecord record = new UpgradeRecord(version, state.getObjectsCreated());
        try {
            client.createObject(className, record.toProperties());
        } catch (Exception e) {
            log.error("Failed to import object for version {}: {}", version, e.getMessage(), e);
            throw new ImportException(
                String.format("object %d for version %s was rejected: %s", record.getObjectCount(), version, e.getMessage()), e);
        }

        RunState next = state.withObjectCreated();
        log.info("Imported object {} for version {}", record.getObjectCount(), version);
        metricsProvider.gauge(OBJECTS_CREATED_METRIC_NAME, next.getObjectsCreated(), Map.of());
        return next;
    }
}
