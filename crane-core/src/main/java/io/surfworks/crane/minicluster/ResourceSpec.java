package io.surfworks.crane.minicluster;

import io.surfworks.crane.resource.Logical;

import java.util.Objects;

/**
 * Resources requested for a mini cluster.
 *
 * @param amResource  resources of the application manager container
 * @param minResource minimum resources the job needs to run
 * @param maxResource maximum resources the job can use
 */
public record ResourceSpec(Logical amResource, Logical minResource, Logical maxResource) {

    public ResourceSpec {
        Objects.requireNonNull(amResource, "amResource cannot be null");
        minResource = minResource == null ? amResource : minResource;
        maxResource = maxResource == null ? minResource : maxResource;

        if (maxResource.isLessThan(minResource)) {
            throw new IllegalArgumentException(String.format(
                    "Maximum resource (%s) smaller than minimum resource (%s)", maxResource, minResource));
        }
        if (!amResource.isLessOrEqual(minResource)) {
            throw new IllegalArgumentException(String.format(
                    "Minimum resource (%s) should not be smaller than app manager resource (%s)",
                    minResource, amResource));
        }
        if (maxResource.isEmpty()) {
            throw new IllegalArgumentException("Maximum resource (" + maxResource + ") cannot be empty");
        }
    }

    /**
     * Creates a spec whose minimum and maximum equal the app manager resource.
     */
    public static ResourceSpec of(Logical amResource) {
        return new ResourceSpec(amResource, null, null);
    }

    /**
     * Creates a spec for a job needing between {@code minGpu} and {@code maxGpu} GPUs,
     * with a one-GPU application manager.
     */
    public static ResourceSpec gpus(int minGpu, int maxGpu) {
        return new ResourceSpec(Logical.gpus(1), Logical.gpus(minGpu), Logical.gpus(maxGpu));
    }
}
