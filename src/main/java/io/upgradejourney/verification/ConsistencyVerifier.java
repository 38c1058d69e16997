package io.upgradejourney.verification;

import io.upgradejourney.client.ServiceClient;
import io.upgradejourney.enums.ErrorKind;
import io.upgradejourney.exceptions.AggregateMismatchException;
import io.upgradejourney.exceptions.DataLossException;
import io.upgradejourney.exceptions.HarnessException;
import io.upgradejourney.models.UpgradeRecord;
import io.upgradejourney.models.VersionSequence;
import io.upgradejourney.models.WhereFilter;
import io.upgradejourney.retry.Retrier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-only checks that everything written so far survived the upgrades.
 *
 * <p>Reads tolerate records that are not visible yet: a short result is retried within the
 * visibility policy before it is reported as data loss.
 */
@Slf4j
public class ConsistencyVerifier {

    static final List<String> QUERY_FIELDS = List.of(
        "_additional { id }",
        UpgradeRecord.VERSION_PROPERTY,
        UpgradeRecord.OBJECT_COUNT_PROPERTY
    );

    private final ServiceClient client;
    private final String className;
    private final Retrier visibilityRetrier;

    public ConsistencyVerifier(ServiceClient client, String className, Retrier visibilityRetrier) {
        this.client = client;
        this.className = className;
        this.visibilityRetrier = visibilityRetrier;
    }

    /**
     * Re-read the records written at steps {@code 0..uptoIndex}, one filtered read per version.
     * A version repeated in the sequence is expected once per occurrence.
     *
     * @return every record found, {@code uptoIndex + 1} in total
     * @throws DataLossException naming the first version, in sequence order, whose records are
     *                           missing, duplicated or changed
     */
    public List<UpgradeRecord> findEachImportedObject(VersionSequence sequence, int uptoIndex) {
        Map<String, List<Long>> expectedByVersion = new LinkedHashMap<>();
        List<String> window = sequence.window(uptoIndex);
        for (int i = 0; i < window.size(); i++) {
            expectedByVersion.computeIfAbsent(window.get(i), v -> new ArrayList<>()).add((long) i);
        }

        List<UpgradeRecord> found = new ArrayList<>();
        for (Map.Entry<String, List<Long>> entry : expectedByVersion.entrySet()) {
            found.addAll(findVersion(entry.getKey(), entry.getValue()));
        }
        log.info("Found all {} imported objects across {} versions", found.size(), expectedByVersion.size());
        return found;
    }

    /**
     * Compare the service-computed count of all objects with {@code expectedCount}.
     * A count that is still below the expected value is retried within the visibility policy.
     *
     * @throws AggregateMismatchException if the counts differ once the wait is over
     */
    public long aggregateObjects(long expectedCount) {
        AtomicLong lastSeen = new AtomicLong(-1);
        Optional<Long> settled = visibilityRetrier.retryUntilPresent("aggregate " + className, () -> {
            long actual = count();
            lastSeen.set(actual);
            return actual < expectedCount ? Optional.empty() : Optional.of(actual);
        });

        long actual = settled.orElse(lastSeen.get());
        if (actual != expectedCount) {
            log.error("Aggregate count mismatch for {}: wanted {}, got {}", className, expectedCount, actual);
            throw new AggregateMismatchException(expectedCount, actual);
        }
        log.info("Aggregate count for {} is {}", className, actual);
        return actual;
    }

    private List<UpgradeRecord> findVersion(String version, List<Long> expectedCounts) {
        Optional<List<UpgradeRecord>> visible = visibilityRetrier.retryUntilPresent("read " + version, () -> {
            List<UpgradeRecord> matches = fetch(version);
            if (matches.size() < expectedCounts.size()) {
                log.debug("Version {}: {} of {} objects visible", version, matches.size(), expectedCounts.size());
                return Optional.empty();
            }
            return Optional.of(matches);
        });

        if (visible.isEmpty()) {
            log.error("Object(s) for version {} not found", version);
            throw new DataLossException(version,
                String.format("wanted %d object(s) for version %s, not found after %d attempts",
                    expectedCounts.size(), version, visibilityRetrier.getPolicy().getMaxAttempts()));
        }

        List<UpgradeRecord> matches = visible.get();
        if (matches.size() > expectedCounts.size()) {
            throw new DataLossException(version,
                String.format("wanted %d object(s) for version %s, got %d", expectedCounts.size(), version, matches.size()));
        }

        List<Long> actualCounts = new ArrayList<>();
        for (UpgradeRecord match : matches) {
            if (!version.equals(match.getVersion())) {
                throw new DataLossException(version,
                    String.format("wanted %s got %s", version, match.getVersion()));
            }
            actualCounts.add(match.getObjectCount());
        }
        actualCounts.sort(null);
        if (!actualCounts.equals(expectedCounts)) {
            throw new DataLossException(version,
                String.format("version %s: wanted object counts %s, got %s", version, expectedCounts, actualCounts));
        }
        return matches;
    }

    private List<UpgradeRecord> fetch(String version) {
        List<Map<String, Object>> rows;
        try {
            rows = client.query(className, WhereFilter.stringEquals(UpgradeRecord.VERSION_PROPERTY, version), QUERY_FIELDS);
        } catch (Exception e) {
            log.error("Query for version {} failed: {}", version, e.getMessage(), e);
            throw new DataLossException(version, "read of version " + version + " failed: " + e.getMessage(), e);
        }

        List<UpgradeRecord> records = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Object recordVersion = row.get(UpgradeRecord.VERSION_PROPERTY);
            Object objectCount = row.get(UpgradeRecord.OBJECT_COUNT_PROPERTY);
            records.add(new UpgradeRecord(
                recordVersion instanceof String ? (String) recordVersion : null,
                objectCount instanceof Number ? ((Number) objectCount).longValue() : -1L));
        }
        return records;
    }

    private long count() {
        try {
            return client.aggregateCount(className);
        } catch (Exception e) {
            log.error("Aggregate query on {} failed: {}", className, e.getMessage(), e);
            throw new HarnessException(ErrorKind.AGGREGATE_MISMATCH,
                "aggregate on " + className + " failed: " + e.getMessage(), e);
        }
    }
}
