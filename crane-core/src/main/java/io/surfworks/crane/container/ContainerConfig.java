package io.surfworks.crane.container;

import io.surfworks.crane.resource.Logical;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Container configuration given by the user: the logical specification of a container.
 *
 * @param image        container image
 * @param resourceSpec GPUs the container needs
 * @param command      command to run; null falls back to the image's command
 * @param envs         environment variables
 */
public record ContainerConfig(
        Image image,
        Logical resourceSpec,
        String command,
        Map<String, String> envs
) {

    public ContainerConfig {
        Objects.requireNonNull(image, "image cannot be null");
        Objects.requireNonNull(resourceSpec, "resourceSpec cannot be null");
        envs = envs == null ? Map.of() : Map.copyOf(envs);
    }

    /**
     * Creates a configuration running the image's own command.
     */
    public static ContainerConfig of(String image, Logical resourceSpec) {
        return new ContainerConfig(new Image(image), resourceSpec, null, Map.of());
    }

    /**
     * Returns a new config with the specified command.
     */
    public ContainerConfig withCommand(String command) {
        return new ContainerConfig(image, resourceSpec, command, envs);
    }

    /**
     * Returns a new config with an additional environment variable.
     */
    public ContainerConfig withEnv(String key, String value) {
        Map<String, String> newEnvs = new HashMap<>(envs);
        newEnvs.put(key, value);
        return new ContainerConfig(image, resourceSpec, command, newEnvs);
    }
}
