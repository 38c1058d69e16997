package io.upgradejourney.cluster;

/**
 * Lifecycle capability for the nodes of the cluster under test, implemented by whatever
 * container or orchestration layer actually runs them.
 */
public interface NodeRuntime extends AutoCloseable {

    /**
     * Create the network the nodes share. Called once before the first node starts.
     *
     * @return name of the network
     */
    String startNetwork() throws Exception;

    /**
     * Start node {@code index} running {@code version}. Returns once the start was issued,
     * not once the node is ready.
     */
    void startNode(int index, String version) throws Exception;

    /**
     * Stop node {@code index}, keeping its persisted data for the replacement.
     */
    void stopNode(int index) throws Exception;

    /**
     * Whether node {@code index} answers its readiness probe.
     */
    boolean isNodeReady(int index) throws Exception;

    /**
     * Whether the cluster as a whole reports all {@code expectedNodes} members healthy.
     */
    boolean isClusterHealthy(int expectedNodes) throws Exception;

    /**
     * Stop every node and release the network.
     */
    @Override
    void close() throws Exception;
}
