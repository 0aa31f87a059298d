package io.surfworks.crane.config;

import io.surfworks.crane.resource.Physical;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Configuration for a crane cluster.
 *
 * <p>Loaded from {@code ~/.config/crane/config.json} by {@link CraneConfigLoader};
 * any value missing from the file falls back to its default.
 *
 * @param masterHost host the cluster master listens on
 * @param masterPort port the cluster master listens on
 * @param nodes      GPU inventory of each worker node
 */
public record CraneConfig(
        String masterHost,
        int masterPort,
        Map<String, Physical> nodes
) {

    /** Default master host */
    public static final String DEFAULT_MASTER_HOST = "localhost";

    /** Default master port */
    public static final int DEFAULT_MASTER_PORT = 7000;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "crane"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "config.json";

    public CraneConfig {
        Objects.requireNonNull(masterHost, "masterHost cannot be null");
        Objects.requireNonNull(nodes, "nodes cannot be null");

        if (masterHost.isBlank()) {
            throw new IllegalArgumentException("masterHost cannot be blank");
        }
        if (masterPort < 1 || masterPort > 65535) {
            throw new IllegalArgumentException("masterPort must be between 1 and 65535, got " + masterPort);
        }
        nodes.forEach((node, gpus) -> {
            Objects.requireNonNull(node, "node name cannot be null");
            Objects.requireNonNull(gpus, "GPUs of node " + node + " cannot be null");
        });
        nodes = Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
    }

    /**
     * Returns the default configuration: a local master and no worker nodes.
     */
    public static CraneConfig defaults() {
        return new CraneConfig(DEFAULT_MASTER_HOST, DEFAULT_MASTER_PORT, Map.of());
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    /**
     * Returns a new config with the specified master address.
     */
    public CraneConfig withMaster(String host, int port) {
        return new CraneConfig(host, port, nodes);
    }

    /**
     * Returns a new config with the node added, replacing any node of the same name.
     */
    public CraneConfig withNode(String node, Physical gpus) {
        Map<String, Physical> updated = new TreeMap<>(nodes);
        updated.put(node, gpus);
        return new CraneConfig(masterHost, masterPort, updated);
    }

    /**
     * Returns a new config with the specified node inventory.
     */
    public CraneConfig withNodes(Map<String, Physical> inventory) {
        return new CraneConfig(masterHost, masterPort, inventory);
    }
}
