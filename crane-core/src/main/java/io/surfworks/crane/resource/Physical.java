package io.surfworks.crane.resource;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A physical resource: a concrete set of GPU indices on one node.
 *
 * <p>Duplicate indices collapse, so {@code Physical.of(1, 1, 2)} equals
 * {@code Physical.of(1, 2)}. The ordering is set inclusion.
 *
 * @param gpuIndices GPU device indices (non-negative, sorted, no duplicates)
 */
public record Physical(SortedSet<Integer> gpuIndices) implements PhysicalResource<Physical, Logical> {

    private static final Physical EMPTY = new Physical(new TreeSet<>());

    public Physical {
        Objects.requireNonNull(gpuIndices, "gpuIndices cannot be null");
        TreeSet<Integer> copy = new TreeSet<>();
        for (Integer index : gpuIndices) {
            copy.add(checkIndex(index));
        }
        gpuIndices = Collections.unmodifiableSortedSet(copy);
    }

    private static Integer checkIndex(Integer index) {
        if (index == null || index < 0) {
            throw ResourceException.invalidConstruction("GPU index must be non-negative, got " + index);
        }
        return index;
    }

    /**
     * Returns the empty physical resource.
     */
    public static Physical empty() {
        return EMPTY;
    }

    /**
     * Creates a physical resource from GPU indices.
     */
    public static Physical of(int... gpuIndices) {
        TreeSet<Integer> indices = new TreeSet<>();
        Arrays.stream(gpuIndices).forEach(indices::add);
        return new Physical(indices);
    }

    /**
     * Creates a physical resource from GPU indices, collapsing duplicates.
     */
    public static Physical of(Collection<Integer> gpuIndices) {
        Objects.requireNonNull(gpuIndices, "gpuIndices cannot be null");
        TreeSet<Integer> indices = new TreeSet<>();
        for (Integer index : gpuIndices) {
            indices.add(checkIndex(index));
        }
        return new Physical(indices);
    }

    /**
     * Creates a physical resource of GPUs {@code 0 .. count-1}.
     */
    public static Physical range(int count) {
        if (count < 0) {
            throw ResourceException.invalidConstruction("GPU count must be non-negative, got " + count);
        }
        TreeSet<Integer> indices = new TreeSet<>();
        for (int i = 0; i < count; i++) {
            indices.add(i);
        }
        return new Physical(indices);
    }

    /**
     * Returns the number of GPUs.
     */
    public int size() {
        return gpuIndices.size();
    }

    /**
     * Returns true if this resource holds the GPU with the given index.
     */
    public boolean contains(int gpuIndex) {
        return gpuIndices.contains(gpuIndex);
    }

    /**
     * Returns the {@code count} lowest GPU indices of this resource.
     *
     * @throws ResourceException if {@code count} is negative or fewer than {@code count} GPUs are present
     */
    public Physical take(int count) {
        if (count < 0) {
            throw ResourceException.invalidConstruction("GPU count must be non-negative, got " + count);
        }
        if (count > gpuIndices.size()) {
            throw ResourceException.insufficient(this, Logical.gpus(count));
        }
        TreeSet<Integer> taken = new TreeSet<>();
        for (Integer index : gpuIndices) {
            if (taken.size() == count) {
                break;
            }
            taken.add(index);
        }
        return new Physical(taken);
    }

    @Override
    public Logical asLogical() {
        return Logical.gpus(gpuIndices.size());
    }

    @Override
    public Physical intersect(Physical other) {
        TreeSet<Integer> common = new TreeSet<>(gpuIndices);
        common.retainAll(other.gpuIndices);
        return new Physical(common);
    }

    @Override
    public Physical plus(Physical other) {
        if (!Collections.disjoint(gpuIndices, other.gpuIndices)) {
            throw ResourceException.conflict(this, other);
        }
        TreeSet<Integer> union = new TreeSet<>(gpuIndices);
        union.addAll(other.gpuIndices);
        return new Physical(union);
    }

    @Override
    public Physical minus(Physical other) {
        if (!gpuIndices.containsAll(other.gpuIndices)) {
            throw ResourceException.insufficient(this, other);
        }
        TreeSet<Integer> difference = new TreeSet<>(gpuIndices);
        difference.removeAll(other.gpuIndices);
        return new Physical(difference);
    }

    @Override
    public boolean isEmpty() {
        return gpuIndices.isEmpty();
    }

    @Override
    public boolean isLessThan(Physical other) {
        return other.gpuIndices.size() > gpuIndices.size() && other.gpuIndices.containsAll(gpuIndices);
    }

    @Override
    public boolean isGreaterThan(Physical other) {
        return other.isLessThan(this);
    }

    @Override
    public String toString() {
        return "Physical(gpuIndices=" + gpuIndices + ")";
    }
}
