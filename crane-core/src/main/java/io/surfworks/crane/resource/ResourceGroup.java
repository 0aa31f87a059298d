package io.surfworks.crane.resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * A mapping from node name to a resource unit, representing a cluster-wide resource view.
 *
 * <p>Empty entries are never stored: adding never creates one, and subtraction
 * drops nodes whose remaining resource is empty. Constructing a group with an
 * empty entry is a programming error.
 *
 * <p>Containment is key-wise: {@code a.isLessThan(b)} when every node of
 * {@code a} is present in {@code b} with a contained resource and the groups
 * differ.
 *
 * @param <R> the resource unit type
 */
public final class ResourceGroup<R extends Resource<R>> implements Resource<ResourceGroup<R>> {

    private static final ResourceGroup<?> EMPTY = new ResourceGroup<Logical>(Map.of());

    private final Map<String, R> resources;

    private ResourceGroup(Map<String, R> resources) {
        TreeMap<String, R> copy = new TreeMap<>();
        resources.forEach((node, resource) -> {
            Objects.requireNonNull(node, "node cannot be null");
            Objects.requireNonNull(resource, "resource cannot be null");
            if (resource.isEmpty()) {
                throw new IllegalArgumentException("Resource of node '" + node + "' is empty");
            }
            copy.put(node, resource);
        });
        this.resources = Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Creates a resource group.
     *
     * @throws IllegalArgumentException if a resource is empty
     */
    public static <R extends Resource<R>> ResourceGroup<R> of(Map<String, R> resources) {
        return resources.isEmpty() ? empty() : new ResourceGroup<>(resources);
    }

    /**
     * Creates a resource group of a single node.
     */
    public static <R extends Resource<R>> ResourceGroup<R> of(String node, R resource) {
        return new ResourceGroup<>(Map.of(node, resource));
    }

    /**
     * Returns the empty resource group.
     */
    @SuppressWarnings("unchecked")
    public static <R extends Resource<R>> ResourceGroup<R> empty() {
        return (ResourceGroup<R>) EMPTY;
    }

    /**
     * Projects every entry of a physical group onto its logical counterpart.
     */
    public static <P extends PhysicalResource<P, L>, L extends Resource<L>> ResourceGroup<L> asLogical(
            ResourceGroup<P> group) {
        return group.project(resource -> resource.asLogical());
    }

    /**
     * Returns the resources two physical groups have in common, dropping empty results.
     */
    public static <P extends PhysicalResource<P, L>, L extends Resource<L>> ResourceGroup<P> intersection(
            ResourceGroup<P> left, ResourceGroup<P> right) {
        return left.intersect(right, (a, b) -> a.intersect(b));
    }

    /**
     * Returns the resource of a node, if present.
     */
    public Optional<R> get(String node) {
        return Optional.ofNullable(resources.get(node));
    }

    public boolean contains(String node) {
        return resources.containsKey(node);
    }

    /**
     * Returns the node names, sorted.
     */
    public Set<String> nodes() {
        return resources.keySet();
    }

    /**
     * Returns an unmodifiable view of the mapping, sorted by node name.
     */
    public Map<String, R> asMap() {
        return resources;
    }

    public int size() {
        return resources.size();
    }

    /**
     * Adds up every entry into a single resource.
     *
     * @param identity the empty value of the unit type
     */
    public R reduce(R identity) {
        return Resource.sum(identity, resources.values());
    }

    /**
     * Maps every entry onto another resource type, dropping entries that become empty.
     */
    public <T extends Resource<T>> ResourceGroup<T> project(Function<? super R, T> projection) {
        Map<String, T> projected = new LinkedHashMap<>();
        resources.forEach((node, resource) -> {
            T value = projection.apply(resource);
            if (value.nonEmpty()) {
                projected.put(node, value);
            }
        });
        return of(projected);
    }

    /**
     * Combines the entries of nodes present in both groups, dropping empty results.
     */
    public ResourceGroup<R> intersect(ResourceGroup<R> other, BinaryOperator<R> operator) {
        Map<String, R> common = new LinkedHashMap<>();
        resources.forEach((node, resource) -> {
            R theirs = other.resources.get(node);
            if (theirs == null) {
                return;
            }
            R value = operator.apply(resource, theirs);
            if (value.nonEmpty()) {
                common.put(node, value);
            }
        });
        return of(common);
    }

    @Override
    public ResourceGroup<R> plus(ResourceGroup<R> other) {
        Map<String, R> merged = new LinkedHashMap<>(resources);
        other.resources.forEach((node, resource) ->
                merged.merge(node, resource, (mine, theirs) -> mine.plus(theirs)));
        return of(merged);
    }

    @Override
    public ResourceGroup<R> minus(ResourceGroup<R> other) {
        if (!resources.keySet().containsAll(other.resources.keySet())) {
            throw ResourceException.invalidKeySet(resources.keySet(), other.resources.keySet());
        }
        Map<String, R> remaining = new LinkedHashMap<>();
        resources.forEach((node, resource) -> {
            R theirs = other.resources.get(node);
            R value = theirs == null ? resource : resource.minus(theirs);
            if (value.nonEmpty()) {
                remaining.put(node, value);
            }
        });
        return of(remaining);
    }

    @Override
    public boolean isEmpty() {
        return resources.isEmpty();
    }

    @Override
    public boolean isLessThan(ResourceGroup<R> other) {
        return containedIn(this, other) && !equals(other);
    }

    @Override
    public boolean isGreaterThan(ResourceGroup<R> other) {
        return containedIn(other, this) && !equals(other);
    }

    private static <R extends Resource<R>> boolean containedIn(ResourceGroup<R> inner, ResourceGroup<R> outer) {
        for (Map.Entry<String, R> entry : inner.resources.entrySet()) {
            R theirs = outer.resources.get(entry.getKey());
            if (theirs == null || !entry.getValue().isLessOrEqual(theirs)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceGroup<?> that)) return false;
        return resources.equals(that.resources);
    }

    @Override
    public int hashCode() {
        return resources.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceGroup" + resources;
    }
}
