package io.surfworks.crane.container;

import io.surfworks.crane.resource.Physical;
import io.surfworks.crane.resource.ResourceGroup;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * GPUs assigned to a container on one node.
 *
 * @param nodeName     node the container runs on
 * @param resourceSpec GPUs of that node given to the container
 */
public record ContainerAllocation(String nodeName, Physical resourceSpec) {

    public ContainerAllocation {
        Objects.requireNonNull(nodeName, "nodeName cannot be null");
        Objects.requireNonNull(resourceSpec, "resourceSpec cannot be null");
    }

    /**
     * Returns the GPU indices as a {@code CUDA_VISIBLE_DEVICES} value, e.g. {@code "0,2"}.
     */
    public String gpuString() {
        return resourceSpec.gpuIndices().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    /**
     * Returns this allocation as a single-node resource group; empty if no GPU is assigned.
     */
    public ResourceGroup<Physical> toPhysicalCluster() {
        if (resourceSpec.isEmpty()) {
            return ResourceGroup.empty();
        }
        return ResourceGroup.of(nodeName, resourceSpec);
    }
}
