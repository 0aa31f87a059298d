package io.surfworks.crane.resource;

/**
 * Exception thrown when a resource operation cannot be applied.
 *
 * <p>Resource values are immutable, so a failed operation never leaves a
 * partially updated value behind.
 */
public class ResourceException extends RuntimeException {

    private final ErrorCode errorCode;

    public ResourceException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ResourceException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Resource operation error codes.
     */
    public enum ErrorCode {
        /** Malformed resource literal, e.g. a negative GPU count */
        INVALID_CONSTRUCTION,

        /** Two resources claim the same physical unit */
        RESOURCE_CONFLICT,

        /** Not enough resource to subtract, acquire or release */
        INSUFFICIENT_RESOURCE,

        /** A group operation references a node the receiver does not have */
        INVALID_KEY_SET
    }

    public static ResourceException invalidConstruction(String message) {
        return new ResourceException(message, ErrorCode.INVALID_CONSTRUCTION);
    }

    public static ResourceException conflict(Object left, Object right) {
        return new ResourceException(
                String.format("Overlapping resources: %s and %s", left, right),
                ErrorCode.RESOURCE_CONFLICT);
    }

    public static ResourceException insufficient(Object available, Object requested) {
        return new ResourceException(
                String.format("Insufficient resource: %s cannot cover %s", available, requested),
                ErrorCode.INSUFFICIENT_RESOURCE);
    }

    public static ResourceException invalidKeySet(Object available, Object requested) {
        return new ResourceException(
                String.format("Unknown nodes %s (known nodes: %s)", requested, available),
                ErrorCode.INVALID_KEY_SET);
    }
}
