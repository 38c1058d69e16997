package io.upgradejourney.models;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A version-tagged document written once per step.
 */
@Data
@AllArgsConstructor
public class UpgradeRecord {

    public static final String VERSION_PROPERTY = "version";
    public static final String OBJECT_COUNT_PROPERTY = "object_count";

    private String version;
    private long objectCount;

    public Map<String, Object> toProperties() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(VERSION_PROPERTY, version);
        props.put(OBJECT_COUNT_PROPERTY, objectCount);
        return props;
    }
}
