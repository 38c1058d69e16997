package io.upgradejourney.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.upgradejourney.models.ClassSchema;
import io.upgradejourney.models.WhereFilter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link ServiceClient} over the service's REST and GraphQL endpoints.
 */
@Slf4j
public class HttpServiceClient implements ServiceClient {

    static final String SCHEMA_PATH = "/v1/schema";
    static final String OBJECTS_PATH = "/v1/objects";
    static final String GRAPHQL_PATH = "/v1/graphql";

    private final String endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpServiceClient(String endpoint, ObjectMapper objectMapper, Duration requestTimeout) {
        if (endpoint == null || endpoint.trim().isEmpty()) {
            throw new IllegalArgumentException("Service endpoint cannot be null or empty");
        }
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    @Override
    public void createClass(ClassSchema schema) throws ServiceClientException {
        log.info("Creating class {}", schema.getClassName());
        post(SCHEMA_PATH, objectMapper.valueToTree(schema));
    }

    @Override
    public void createObject(String className, Map<String, Object> properties) throws ServiceClientException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("class", className);
        body.set("properties", objectMapper.valueToTree(properties));
        log.debug("Creating {} object: {}", className, properties);
        post(OBJECTS_PATH, body);
    }

    @Override
    public List<Map<String, Object>> query(String className, WhereFilter filter, List<String> fields)
            throws ServiceClientException {
        String query;
        try {
            query = GraphQLQueries.get(objectMapper, className, filter, fields);
        } catch (IOException e) {
            throw new ServiceClientException("Failed to build query for " + className, e);
        }
        return GraphQLQueries.parseGet(objectMapper, graphql(query), className);
    }

    @Override
    public long aggregateCount(String className) throws ServiceClientException {
        return GraphQLQueries.parseAggregateCount(graphql(GraphQLQueries.aggregateCount(className)), className);
    }

    private JsonNode graphql(String query) throws ServiceClientException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", query);
        log.debug("GraphQL: {}", query);
        String response = post(GRAPHQL_PATH, body);
        try {
            return objectMapper.readTree(response);
        } catch (IOException e) {
            throw new ServiceClientException("Malformed GraphQL response: " + e.getMessage(), e);
        }
    }

    private String post(String path, JsonNode body) throws ServiceClientException {
        String targetUrl = endpoint + path;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(targetUrl))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("POST {} returned {}: {}", targetUrl, response.statusCode(), response.body());
                throw new ServiceClientException(
                    String.format("POST %s returned %d: %s", path, response.statusCode(), response.body()),
                    response.statusCode());
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceClientException("Interrupted while calling " + targetUrl, e);
        } catch (IOException e) {
            log.error("POST {} failed: {}", targetUrl, e.getMessage());
            throw new ServiceClientException("POST " + targetUrl + " failed: " + e.getMessage(), e);
        }
    }
}
