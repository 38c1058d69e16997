package io.upgradejourney.models;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Equality filter on a single string property.
 */
@Data
@AllArgsConstructor
public class WhereFilter {

    private List<String> path;
    private String operator;
    private String valueString;

    public static WhereFilter stringEquals(String property, String value) {
        return new WhereFilter(List.of(property), "Equal", value);
    }
}
