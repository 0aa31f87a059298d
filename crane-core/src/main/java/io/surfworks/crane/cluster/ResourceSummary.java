package io.surfworks.crane.cluster;

import io.surfworks.crane.resource.AllocationGroup;
import io.surfworks.crane.resource.Logical;
import io.surfworks.crane.resource.Physical;
import io.surfworks.crane.resource.ResourceGroup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * GPU usage of a cluster, in total and per node.
 *
 * @param totalGpus number of GPUs in the cluster
 * @param freeGpus  number of released GPUs
 * @param busyGpus  number of acquired GPUs
 * @param nodes     usage of each node
 */
public record ResourceSummary(int totalGpus, int freeGpus, int busyGpus, Map<String, NodeUsage> nodes) {

    public ResourceSummary {
        Objects.requireNonNull(nodes, "nodes cannot be null");
        nodes = Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
    }

    /**
     * Summarizes a physical allocation group.
     */
    public static ResourceSummary of(AllocationGroup<Physical> resources) {
        Map<String, NodeUsage> nodes = new LinkedHashMap<>();
        resources.asMap().forEach((node, allocation) -> nodes.put(node, new NodeUsage(
                allocation.total().size(), allocation.released().size(), allocation.acquired().size())));

        return new ResourceSummary(
                gpuCount(resources.total()),
                gpuCount(resources.released()),
                gpuCount(resources.acquired()),
                nodes);
    }

    private static int gpuCount(ResourceGroup<Physical> group) {
        return ResourceGroup.asLogical(group).reduce(Logical.empty()).numGpu();
    }

    /**
     * Returns the fraction of GPUs in use, between 0 and 1.
     */
    public double utilization() {
        return totalGpus == 0 ? 0.0 : (double) busyGpus / totalGpus;
    }

    /**
     * GPU usage of one node.
     */
    public record NodeUsage(int totalGpus, int freeGpus, int busyGpus) {}
}
