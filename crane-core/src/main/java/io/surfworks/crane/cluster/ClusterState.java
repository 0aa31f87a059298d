package io.surfworks.crane.cluster;

import io.surfworks.crane.minicluster.MiniCluster;
import io.surfworks.crane.resource.AllocationGroup;
import io.surfworks.crane.resource.Physical;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of the cluster that scheduling policies decide on.
 *
 * @param queued    mini clusters waiting for resources, in queue order
 * @param running   mini clusters holding resources
 * @param resources allocation status of every node
 */
public record ClusterState(
        List<MiniCluster> queued,
        List<MiniCluster> running,
        AllocationGroup<Physical> resources
) {

    public ClusterState {
        Objects.requireNonNull(queued, "queued cannot be null");
        Objects.requireNonNull(running, "running cannot be null");
        Objects.requireNonNull(resources, "resources cannot be null");
        queued = List.copyOf(queued);
        running = List.copyOf(running);
    }

    /**
     * Returns the GPU usage of the cluster.
     */
    public ResourceSummary summary() {
        return ResourceSummary.of(resources);
    }
}
