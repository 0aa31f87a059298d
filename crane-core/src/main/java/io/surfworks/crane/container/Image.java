package io.surfworks.crane.container;

import java.util.Objects;

/**
 * Container image chosen by the user.
 *
 * @param name image reference, e.g. {@code snuspl/crane:latest}
 */
public record Image(String name) {

    /** Tag used when the reference has none */
    public static final String DEFAULT_TAG = "latest";

    public Image {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }

    /**
     * Returns the repository part of the reference.
     */
    public String repository() {
        int separator = tagSeparator();
        return separator < 0 ? name : name.substring(0, separator);
    }

    /**
     * Returns the tag part of the reference, {@value #DEFAULT_TAG} if absent.
     */
    public String tag() {
        int separator = tagSeparator();
        return separator < 0 ? DEFAULT_TAG : name.substring(separator + 1);
    }

    // A colon before the last slash belongs to a registry port, not a tag.
    private int tagSeparator() {
        int colon = name.lastIndexOf(':');
        return colon > name.lastIndexOf('/') ? colon : -1;
    }
}
