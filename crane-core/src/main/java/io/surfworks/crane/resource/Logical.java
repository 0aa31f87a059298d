package io.surfworks.crane.resource;

/**
 * A logical resource: a number of GPUs without commitment to particular devices.
 *
 * <p>Used when submitting a job or requesting a container.
 *
 * @param numGpu number of GPUs (non-negative)
 */
public record Logical(int numGpu) implements Resource<Logical> {

    private static final Logical EMPTY = new Logical(0);

    public Logical {
        if (numGpu < 0) {
            throw ResourceException.invalidConstruction("numGpu must be non-negative, got " + numGpu);
        }
    }

    /**
     * Returns the empty logical resource.
     */
    public static Logical empty() {
        return EMPTY;
    }

    /**
     * Creates a logical resource of {@code numGpu} GPUs.
     */
    public static Logical gpus(int numGpu) {
        return numGpu == 0 ? EMPTY : new Logical(numGpu);
    }

    /**
     * Adds up logical resources.
     */
    public static Logical sum(Iterable<Logical> resources) {
        return Resource.sum(EMPTY, resources);
    }

    @Override
    public Logical plus(Logical other) {
        return new Logical(Math.addExact(numGpu, other.numGpu));
    }

    @Override
    public Logical minus(Logical other) {
        int remaining = numGpu - other.numGpu;
        if (remaining < 0) {
            throw ResourceException.insufficient(this, other);
        }
        return new Logical(remaining);
    }

    @Override
    public boolean isEmpty() {
        return numGpu == 0;
    }

    @Override
    public boolean isLessThan(Logical other) {
        return numGpu < other.numGpu;
    }

    @Override
    public boolean isGreaterThan(Logical other) {
        return numGpu > other.numGpu;
    }

    @Override
    public String toString() {
        return "Logical(numGpu=" + numGpu + ")";
    }
}
