package io.upgradejourney.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One property of a class definition.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PropertySchema {

    @JsonProperty("name")
    private String name;

    @JsonProperty("dataType")
    private List<String> dataType;

    public static PropertySchema of(String name, String dataType) {
        return new PropertySchema(name, List.of(dataType));
    }
}
