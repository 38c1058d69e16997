package io.upgradejourney.support;

import io.upgradejourney.cluster.NodeRuntime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Node runtime double that records lifecycle calls. Nodes report ready immediately
 * unless they were told to never rejoin.
 */
public class FakeNodeRuntime implements NodeRuntime {

    private final Map<Integer, String> running = new TreeMap<>();
    private final Set<Integer> neverReady = new HashSet<>();
    private final Map<Integer, String> neverReadyOn = new TreeMap<>();
    private final List<String> events = new ArrayList<>();
    private int notReadyProbes;
    private boolean closed;

    public void neverReady(int index) {
        neverReady.add(index);
    }

    /**
     * Node {@code index} never becomes ready once it runs {@code version}.
     */
    public void neverReady(int index, String version) {
        neverReadyOn.put(index, version);
    }

    /**
     * Report not-ready for the next {@code probes} readiness checks.
     */
    public void slowStart(int probes) {
        this.notReadyProbes = probes;
    }

    public List<String> getEvents() {
        return events;
    }

    public Map<Integer, String> getRunning() {
        return running;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String startNetwork() {
        events.add("network");
        return "test-network";
    }

    @Override
    public void startNode(int index, String version) {
        events.add("start " + index + " " + version);
        running.put(index, version);
    }

    @Override
    public void stopNode(int index) {
        events.add("stop " + index);
        running.remove(index);
    }

    @Override
    public boolean isNodeReady(int index) {
        if (notReadyProbes > 0) {
            notReadyProbes--;
            return false;
        }
        String version = running.get(index);
        return version != null
            && !neverReady.contains(index)
            && !version.equals(neverReadyOn.get(index));
    }

    @Override
    public boolean isClusterHealthy(int expectedNodes) {
        return running.size() == expectedNodes;
    }

    @Override
    public void close() {
        events.add("close");
        running.clear();
        closed = true;
    }
}
