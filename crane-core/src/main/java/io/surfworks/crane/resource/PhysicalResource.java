package io.surfworks.crane.resource;

/**
 * A resource made of concrete, addressable units.
 *
 * @param <P> the physical resource type
 * @param <L> the matching logical resource type
 */
public interface PhysicalResource<P extends PhysicalResource<P, L>, L extends Resource<L>> extends Resource<P> {

    /**
     * Returns the logical resource that reflects this physical resource.
     */
    L asLogical();

    /**
     * Returns the units common to this resource and {@code other}.
     */
    P intersect(P other);
}
