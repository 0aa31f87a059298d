package io.surfworks.crane.testing;

import io.surfworks.crane.cluster.ClusterState;
import io.surfworks.crane.cluster.ResourceSummary;
import io.surfworks.crane.config.CraneConfig;
import io.surfworks.crane.minicluster.MiniCluster;
import io.surfworks.crane.minicluster.MiniClusterState;
import io.surfworks.crane.minicluster.ResourceSpec;
import io.surfworks.crane.resource.AllocationGroup;
import io.surfworks.crane.resource.Physical;
import io.surfworks.crane.resource.ResourceException;
import io.surfworks.crane.resource.ResourceGroup;
import io.surfworks.crane.state.StateTransitionException;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Simulates a multi-node GPU cluster for testing scheduling and mini cluster lifecycles.
 *
 * <p>Features:
 * <ul>
 *   <li>Node inventory given as physical GPUs per node</li>
 *   <li>FIFO queue with head-of-line blocking</li>
 *   <li>Placement on as few nodes as possible, lowest GPU indices first</li>
 *   <li>Completion, failure, preemption, pause and resume of mini clusters</li>
 * </ul>
 *
 * <p>Every claim and release goes through {@link AllocationGroup#acquire} and
 * {@link AllocationGroup#release}.
 */
public final class ClusterSimulator {

    private static final Logger LOG = Logger.getLogger(ClusterSimulator.class.getName());

    private final Clock clock;
    private final Map<String, MiniCluster> miniClusters = new LinkedHashMap<>();
    private final Deque<MiniCluster> pendingQueue = new ArrayDeque<>();

    private AllocationGroup<Physical> resources;

    /**
     * Creates a cluster simulator with the specified GPUs per node.
     *
     * @param inventory GPUs of each node; nodes without GPUs are ignored
     */
    public ClusterSimulator(Map<String, Physical> inventory) {
        this(inventory, Clock.systemUTC());
    }

    public ClusterSimulator(Map<String, Physical> inventory, Clock clock) {
        Objects.requireNonNull(inventory, "inventory cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");

        Map<String, Physical> gpuNodes = new TreeMap<>();
        inventory.forEach((node, gpus) -> {
            if (gpus.nonEmpty()) {
                gpuNodes.put(node, gpus);
            }
        });
        this.resources = AllocationGroup.released(ResourceGroup.of(gpuNodes));
    }

    /**
     * Creates a simple cluster with N homogeneous nodes named {@code node-0 .. node-(N-1)}.
     */
    public static ClusterSimulator homogeneous(int nodeCount, int gpusPerNode) {
        Map<String, Physical> inventory = new TreeMap<>();
        for (int i = 0; i < nodeCount; i++) {
            inventory.put("node-" + i, Physical.range(gpusPerNode));
        }
        return new ClusterSimulator(inventory);
    }

    /**
     * Creates a cluster from the node inventory of a configuration.
     */
    public static ClusterSimulator fromConfig(CraneConfig config) {
        return new ClusterSimulator(config.nodes());
    }

    /**
     * Queues a new mini cluster.
     *
     * @throws IllegalArgumentException if the id is already in use
     */
    public synchronized MiniCluster submit(String id, ResourceSpec resourceSpec) {
        if (miniClusters.containsKey(id)) {
            throw new IllegalArgumentException("Mini cluster already exists: " + id);
        }
        MiniCluster miniCluster = new MiniCluster(id, resourceSpec);
        miniClusters.put(id, miniCluster);
        pendingQueue.addLast(miniCluster);
        LOG.fine(() -> "Queued " + id + " needing " + resourceSpec.minResource());
        return miniCluster;
    }

    /**
     * Starts queued mini clusters in submission order until the head of the
     * queue no longer fits.
     *
     * @return the mini clusters started by this call
     */
    public synchronized List<MiniCluster> schedule() {
        List<MiniCluster> started = new ArrayList<>();
        MiniCluster head;
        while ((head = pendingQueue.peekFirst()) != null) {
            Optional<ResourceGroup<Physical>> placement = findPlacement(head.resourceSpec());
            if (placement.isEmpty()) {
                break;
            }
            pendingQueue.pollFirst();
            start(head, placement.get());
            started.add(head);
        }
        if (!started.isEmpty()) {
            LOG.info("Started " + started.size() + " mini clusters, " + pendingQueue.size() + " still queued");
        }
        return started;
    }

    /**
     * Marks a running mini cluster as done and frees its GPUs.
     */
    public synchronized void complete(String id) {
        finish(require(id), MiniClusterState.DONE);
    }

    /**
     * Marks a mini cluster as failed, removing it from the queue or freeing its GPUs.
     */
    public synchronized void fail(String id) {
        finish(require(id), MiniClusterState.ERROR);
    }

    /**
     * Takes the GPUs of a running mini cluster and puts it back at the end of the queue.
     */
    public synchronized void preempt(String id) {
        MiniCluster miniCluster = require(id);
        miniCluster.transition(MiniClusterState.QUEUED, clock);
        releaseClaims(miniCluster);
        pendingQueue.addLast(miniCluster);
        LOG.info("Preempted " + id);
    }

    /**
     * Pauses a running mini cluster, freeing its GPUs.
     */
    public synchronized void pause(String id) {
        MiniCluster miniCluster = require(id);
        miniCluster.transition(MiniClusterState.PAUSED, clock);
        releaseClaims(miniCluster);
        LOG.info("Paused " + id);
    }

    /**
     * Resumes a paused mini cluster ahead of the queue.
     *
     * @throws StateTransitionException if the mini cluster is not paused
     * @throws ResourceException         if the cluster lacks free GPUs for it
     */
    public synchronized void resume(String id) {
        MiniCluster miniCluster = require(id);
        if (miniCluster.state() != MiniClusterState.PAUSED) {
            throw new StateTransitionException(miniCluster.state(), MiniClusterState.RUNNING);
        }

        ResourceSpec spec = miniCluster.resourceSpec();
        ResourceGroup<Physical> placement = findPlacement(spec)
                .orElseThrow(() -> ResourceException.insufficient(resources.released(), spec.minResource()));
        start(miniCluster, placement);
    }

    /**
     * Returns a snapshot of the queue, the running mini clusters and the node allocations.
     */
    public synchronized ClusterState clusterState() {
        List<MiniCluster> running = new ArrayList<>();
        for (MiniCluster miniCluster : miniClusters.values()) {
            if (miniCluster.state() == MiniClusterState.RUNNING) {
                running.add(miniCluster);
            }
        }
        return new ClusterState(new ArrayList<>(pendingQueue), running, resources);
    }

    public synchronized Optional<MiniCluster> miniCluster(String id) {
        return Optional.ofNullable(miniClusters.get(id));
    }

    /**
     * Returns the GPU usage of the cluster.
     */
    public synchronized ResourceSummary summary() {
        return ResourceSummary.of(resources);
    }

    public synchronized int getPendingQueueSize() {
        return pendingQueue.size();
    }

    private MiniCluster require(String id) {
        MiniCluster miniCluster = miniClusters.get(id);
        if (miniCluster == null) {
            throw new IllegalArgumentException("Mini cluster not found: " + id);
        }
        return miniCluster;
    }

    private void start(MiniCluster miniCluster, ResourceGroup<Physical> placement) {
        miniCluster.state().validate(MiniClusterState.RUNNING);
        resources = resources.acquire(placement);
        miniCluster.claim(placement);
        miniCluster.transition(MiniClusterState.RUNNING, clock);
        LOG.fine(() -> "Placed " + miniCluster.id() + " on " + placement);
    }

    private void finish(MiniCluster miniCluster, MiniClusterState terminal) {
        miniCluster.transition(terminal, clock);
        pendingQueue.remove(miniCluster);
        releaseClaims(miniCluster);
        LOG.info("Mini cluster " + miniCluster.id() + " finished as " + terminal);
    }

    private void releaseClaims(MiniCluster miniCluster) {
        ResourceGroup<Physical> claimed = miniCluster.unclaim();
        if (claimed.nonEmpty()) {
            resources = resources.release(claimed);
        }
    }

    /**
     * Picks GPUs for the minimum resource of a spec. Nodes with the most free
     * GPUs are filled first, so the job spans as few nodes as possible.
     */
    private Optional<ResourceGroup<Physical>> findPlacement(ResourceSpec spec) {
        int needed = spec.minResource().numGpu();

        List<Map.Entry<String, Physical>> candidates = new ArrayList<>(resources.released().asMap().entrySet());
        candidates.sort(Comparator
                .comparingInt((Map.Entry<String, Physical> entry) -> entry.getValue().size())
                .reversed()
                .thenComparing(Map.Entry::getKey));

        Map<String, Physical> placement = new TreeMap<>();
        for (Map.Entry<String, Physical> candidate : candidates) {
            if (needed == 0) {
                break;
            }
            int count = Math.min(needed, candidate.getValue().size());
            placement.put(candidate.getKey(), candidate.getValue().take(count));
            needed -= count;
        }
        if (needed > 0) {
            return Optional.empty();
        }
        return Optional.of(ResourceGroup.of(placement));
    }
}
