package io.upgradejourney.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.upgradejourney.models.WhereFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds GraphQL query documents for the service and unpacks their responses.
 */
final class GraphQLQueries {

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private GraphQLQueries() {
        // Utility class
    }

    static String get(ObjectMapper mapper, String className, WhereFilter filter, List<String> fields)
            throws JsonProcessingException {
        StringBuilder query = new StringBuilder("{ Get { ").append(className);
        if (filter != null) {
            query.append("(where: ").append(where(mapper, filter)).append(")");
        }
        query.append(" { ").append(String.join(" ", fields)).append(" } } }");
        return query.toString();
    }

    static String aggregateCount(String className) {
        return "{ Aggregate { " + className + " { meta { count } } } }";
    }

    static String where(ObjectMapper mapper, WhereFilter filter) throws JsonProcessingException {
        return "{path: " + mapper.writeValueAsString(filter.getPath())
            + ", operator: " + filter.getOperator()
            + ", valueString: " + mapper.writeValueAsString(filter.getValueString()) + "}";
    }

    static List<Map<String, Object>> parseGet(ObjectMapper mapper, JsonNode response, String className)
            throws ServiceClientException {
        checkErrors(response);
        JsonNode objects = response.path("data").path("Get").path(className);
        List<Map<String, Object>> result = new ArrayList<>();
        if (objects.isNull() || objects.isMissingNode()) {
            return result;
        }
        if (!objects.isArray()) {
            throw new ServiceClientException("Unexpected Get payload for " + className + ": " + objects);
        }
        for (JsonNode object : objects) {
            result.add(mapper.convertValue(object, OBJECT_TYPE));
        }
        return result;
    }

    static long parseAggregateCount(JsonNode response, String className) throws ServiceClientException {
        checkErrors(response);
        JsonNode groups = response.path("data").path("Aggregate").path(className);
        if (!groups.isArray() || groups.isEmpty()) {
            throw new ServiceClientException("Aggregate returned no groups for " + className);
        }
        JsonNode count = groups.get(0).path("meta").path("count");
        if (!count.isNumber()) {
            throw new ServiceClientException("Aggregate returned no count for " + className + ": " + groups);
        }
        return count.asLong();
    }

    private static void checkErrors(JsonNode response) throws ServiceClientException {
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new ServiceClientException("GraphQL errors: " + errors);
        }
    }
}
