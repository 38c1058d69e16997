package io.upgradejourney.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.testcontainers.containers.BindMode;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.Network;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link NodeRuntime} that runs every node as a Docker container on a shared bridge network.
 * Node {@code i} publishes its HTTP port on {@code httpBasePort + i} and keeps its data in a
 * host directory, so a replacement container on a newer image picks up the same data.
 * Starting a node returns once its container runs; callers poll {@link #isNodeReady} for the service.
 */
@Slf4j
public class DockerNodeRuntime implements NodeRuntime {

    static final int HTTP_PORT = 8080;
    static final int GOSSIP_PORT = 7100;
    static final int DATA_PORT = 7101;
    static final String CONTAINER_DATA_PATH = "/var/lib/weaviate";
    static final String READY_PATH = "/v1/.well-known/ready";
    static final String NODES_PATH = "/v1/nodes";
    static final String HEALTHY_STATUS = "HEALTHY";

    private final String image;
    private final String aliasPrefix;
    private final int httpBasePort;
    private final Path dataDir;
    private final int clusterSize;
    private final Duration startupTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<Integer, GenericContainer<?>> containers = new TreeMap<>();
    private Network network;

    public DockerNodeRuntime(String image,
                             String aliasPrefix,
                             int httpBasePort,
                             Path dataDir,
                             int clusterSize,
                             Duration startupTimeout) {
        this.image = image;
        this.aliasPrefix = aliasPrefix;
        this.httpBasePort = httpBasePort;
        this.dataDir = dataDir;
        this.clusterSize = clusterSize;
        this.startupTimeout = startupTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String startNetwork() {
        if (network == null) {
            network = Network.newNetwork();
            log.info("Created cluster network {}", network.getId());
        }
        return network.getId();
    }

    @Override
    public void startNode(int index, String version) throws IOException {
        if (network == null) {
            throw new IllegalStateException("Network must be started before node " + index);
        }
        if (containers.containsKey(index)) {
            throw new IllegalStateException("Node " + index + " is already running");
        }

        Path nodeDataDir = dataDir.resolve(hostname(index));
        Files.createDirectories(nodeDataDir);

        DockerImageName imageName = DockerImageName.parse(image).withTag(version);
        GenericContainer<?> container = new GenericContainer<>(imageName)
            .withNetwork(network)
            .withNetworkAliases(hostname(index))
            .withExposedPorts(HTTP_PORT)
            .withFileSystemBind(nodeDataDir.toAbsolutePath().toString(), CONTAINER_DATA_PATH, BindMode.READ_WRITE)
            .withEnv(nodeEnvironment(index))
            .waitingFor(new ContainerRunningWaitStrategy().withStartupTimeout(startupTimeout));
        container.setPortBindings(List.of(hostPort(index) + ":" + HTTP_PORT));

        log.info("Starting node {} from image {} on host port {}", index, imageName, hostPort(index));
        container.start();
        containers.put(index, container);
    }

    @Override
    public void stopNode(int index) {
        GenericContainer<?> container = containers.remove(index);
        if (container == null) {
            log.warn("Node {} is not running, nothing to stop", index);
            return;
        }
        log.info("Stopping node {} ({})", index, container.getDockerImageName());
        container.stop();
    }

    @Override
    public boolean isNodeReady(int index) throws IOException, InterruptedException {
        if (!containers.containsKey(index)) {
            return false;
        }
        HttpResponse<String> response = get(hostPort(index), READY_PATH);
        return response.statusCode() == 200;
    }

    @Override
    public boolean isClusterHealthy(int expectedNodes) throws IOException, InterruptedException {
        if (containers.isEmpty()) {
            return false;
        }
        int anyNode = containers.keySet().iterator().next();
        HttpResponse<String> response = get(hostPort(anyNode), NODES_PATH);
        if (response.statusCode() != 200) {
            log.debug("Nodes status returned {}", response.statusCode());
            return false;
        }
        return allNodesHealthy(objectMapper.readTree(response.body()), expectedNodes);
    }

    /**
     * Evaluate a nodes-status payload: exactly {@code expectedNodes} members, all healthy.
     */
    static boolean allNodesHealthy(JsonNode payload, int expectedNodes) {
        JsonNode nodes = payload.path("nodes");
        if (!nodes.isArray() || nodes.size() != expectedNodes) {
            return false;
        }
        for (JsonNode node : nodes) {
            if (!HEALTHY_STATUS.equals(node.path("status").asText())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() {
        for (Integer index : new ArrayList<>(containers.keySet())) {
            stopNode(index);
        }
        if (network != null) {
            network.close();
            network = null;
        }
    }

    Map<String, String> nodeEnvironment(int index) {
        Map<String, String> env = new TreeMap<>();
        env.put("QUERY_DEFAULTS_LIMIT", "25");
        env.put("AUTHENTICATION_ANONYMOUS_ACCESS_ENABLED", "true");
        env.put("PERSISTENCE_DATA_PATH", CONTAINER_DATA_PATH);
        env.put("DEFAULT_VECTORIZER_MODULE", "none");
        env.put("CLUSTER_HOSTNAME", hostname(index));
        env.put("CLUSTER_GOSSIP_BIND_PORT", String.valueOf(GOSSIP_PORT));
        env.put("CLUSTER_DATA_BIND_PORT", String.valueOf(DATA_PORT));
        if (index > 0) {
            env.put("CLUSTER_JOIN", hostname(0) + ":" + GOSSIP_PORT);
        }

        List<String> raftPeers = new ArrayList<>();
        for (int i = 0; i < clusterSize; i++) {
            raftPeers.add(hostname(i));
        }
        env.put("RAFT_JOIN", String.join(",", raftPeers));
        env.put("RAFT_BOOTSTRAP_EXPECT", String.valueOf(clusterSize));
        return env;
    }

    String hostname(int index) {
        return aliasPrefix + index;
    }

    int hostPort(int index) {
        return httpBasePort + index;
    }

    private HttpResponse<String> get(int port, String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + port + path))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
