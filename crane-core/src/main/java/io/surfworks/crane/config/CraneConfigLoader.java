package io.surfworks.crane.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.crane.codec.CodecException;
import io.surfworks.crane.codec.Codecs;
import io.surfworks.crane.resource.Physical;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves CraneConfig.
 *
 * <p>The config file ({@code ~/.config/crane/config.json}) looks like:
 * <pre>{@code
 * {
 *   "masterHost": "head-0",
 *   "masterPort": 7000,
 *   "nodes": {
 *     "node-0": {"gpu_indices": [0, 1, 2, 3]},
 *     "node-1": {"gpu_indices": [0, 1]}
 *   }
 * }
 * }</pre>
 *
 * <p>Fields missing from the file keep their defaults. A file that cannot be
 * parsed is logged and ignored.
 */
public final class CraneConfigLoader {

    private static final Logger LOG = Logger.getLogger(CraneConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private CraneConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * @return the loaded configuration, or defaults if the file doesn't exist
     */
    public static CraneConfig load() {
        return load(CraneConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static CraneConfig load(Path configFile) {
        CraneConfig defaults = CraneConfig.defaults();
        if (!Files.exists(configFile)) {
            return defaults;
        }
        try {
            return loadFromFile(configFile, defaults);
        } catch (IOException | CodecException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable config file " + configFile + ": " + e.getMessage(), e);
            return defaults;
        }
    }

    /**
     * Saves configuration to the default config file.
     *
     * @param config the configuration to save
     * @throws IOException if saving fails
     */
    public static void save(CraneConfig config) throws IOException {
        save(config, CraneConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(CraneConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("masterHost", config.masterHost());
        root.put("masterPort", config.masterPort());

        ObjectNode nodes = root.putObject("nodes");
        config.nodes().forEach((node, gpus) -> nodes.set(node, Codecs.PHYSICAL.encode(gpus)));

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
        LOG.fine("Saved config to " + configFile);
    }

    private static CraneConfig loadFromFile(Path configFile, CraneConfig base) throws IOException, CodecException {
        JsonNode root = JSON.readTree(configFile.toFile());
        if (root == null || !root.isObject()) {
            throw new CodecException("Config root must be a JSON object");
        }

        String host = root.has("masterHost") ? root.get("masterHost").asText() : base.masterHost();
        int port = base.masterPort();
        if (root.has("masterPort")) {
            JsonNode portNode = root.get("masterPort");
            if (!portNode.canConvertToInt()) {
                throw new CodecException("masterPort must be an integer, got " + portNode);
            }
            port = portNode.intValue();
        }

        Map<String, Physical> inventory = new TreeMap<>(base.nodes());
        if (root.has("nodes")) {
            JsonNode nodesNode = root.get("nodes");
            if (!nodesNode.isObject()) {
                throw new CodecException("nodes must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = nodesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                inventory.put(field.getKey(), Codecs.PHYSICAL.decode(field.getValue()));
            }
        }

        CraneConfig config = new CraneConfig(host, port, inventory);
        LOG.fine(() -> "Loaded config from " + configFile + " with " + config.nodes().size() + " nodes");
        return config;
    }
}
