package io.upgradejourney.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Class definition sent to the service's schema endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClassSchema {

    @JsonProperty("class")
    private String className;

    @JsonProperty("vectorizer")
    private String vectorizer = "none";

    @JsonProperty("properties")
    private List<PropertySchema> properties = new ArrayList<>();

    public ClassSchema(String className, List<PropertySchema> properties) {
        this.className = className;
        this.properties = properties;
    }
}
