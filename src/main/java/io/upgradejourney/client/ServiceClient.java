package io.upgradejourney.client;

import io.upgradejourney.models.ClassSchema;
import io.upgradejourney.models.WhereFilter;

import java.util.List;
import java.util.Map;

/**
 * Data capability of the service under test: schema, writes, filtered reads and aggregates.
 */
public interface ServiceClient {

    /**
     * Create a class. Fails if the service rejects the definition, including when it already exists.
     */
    void createClass(ClassSchema schema) throws Exception;

    /**
     * Create one object. Returns once the service has acknowledged the write.
     */
    void createObject(String className, Map<String, Object> properties) throws Exception;

    /**
     * Fetch the requested fields of every object of {@code className} matching {@code filter}.
     */
    List<Map<String, Object>> query(String className, WhereFilter filter, List<String> fields) throws Exception;

    /**
     * Service-computed count of all objects of {@code className}.
     */
    long aggregateCount(String className) throws Exception;
}
