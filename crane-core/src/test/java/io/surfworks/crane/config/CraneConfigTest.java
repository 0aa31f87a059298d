package io.surfworks.crane.config;

import io.surfworks.crane.resource.Physical;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CraneConfig and CraneConfigLoader.
 */
class CraneConfigTest {

    @TempDir
    Path tempDir;

    // ===== CraneConfig tests =====

    @Test
    void defaultsReturnsValidConfig() {
        CraneConfig config = CraneConfig.defaults();

        assertEquals("localhost", config.masterHost());
        assertEquals(7000, config.masterPort());
        assertTrue(config.nodes().isEmpty());
    }

    @Test
    void blankHostFails() {
        assertThrows(IllegalArgumentException.class, () -> new CraneConfig(" ", 7000, Map.of()));
    }

    @Test
    void portOutOfRangeFails() {
        assertThrows(IllegalArgumentException.class, () -> new CraneConfig("localhost", 0, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new CraneConfig("localhost", 65536, Map.of()));
    }

    @Test
    void withMethodsCreateNewInstances() {
        CraneConfig base = CraneConfig.defaults();
        CraneConfig modified = base.withMaster("head-0", 9000).withNode("node-1", Physical.range(2));

        assertEquals("localhost", base.masterHost());
        assertTrue(base.nodes().isEmpty());
        assertEquals("head-0", modified.masterHost());
        assertEquals(9000, modified.masterPort());
        assertEquals(Physical.range(2), modified.nodes().get("node-1"));
    }

    @Test
    void nodesAreSortedByName() {
        CraneConfig config = CraneConfig.defaults()
                .withNode("node-b", Physical.of(0))
                .withNode("node-a", Physical.of(1));

        assertEquals(List.of("node-a", "node-b"), List.copyOf(config.nodes().keySet()));
    }

    @Test
    void configFileIsUnderUserConfigDir() {
        assertTrue(CraneConfig.configFile().endsWith(Path.of(".config", "crane", "config.json")));
    }

    // ===== CraneConfigLoader tests =====

    @Test
    void loadMissingFileReturnsDefaults() {
        CraneConfig config = CraneConfigLoader.load(tempDir.resolve("missing.json"));

        assertEquals(CraneConfig.defaults(), config);
    }

    @Test
    void saveAndLoadRoundTrip() throws IOException {
        Path configFile = tempDir.resolve("nested").resolve("config.json");
        CraneConfig original = CraneConfig.defaults()
                .withMaster("head-0", 7100)
                .withNodes(Map.of(
                        "node-0", Physical.range(4),
                        "node-1", Physical.of(0, 2)));

        CraneConfigLoader.save(original, configFile);
        CraneConfig loaded = CraneConfigLoader.load(configFile);

        assertTrue(Files.exists(configFile));
        assertEquals(original, loaded);
    }

    @Test
    void partialFileKeepsDefaults() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{\"nodes\": {\"node-0\": {\"gpu_indices\": [0, 1]}}}");

        CraneConfig config = CraneConfigLoader.load(configFile);

        assertEquals(CraneConfig.DEFAULT_MASTER_HOST, config.masterHost());
        assertEquals(CraneConfig.DEFAULT_MASTER_PORT, config.masterPort());
        assertEquals(Physical.of(0, 1), config.nodes().get("node-0"));
    }

    @Test
    void malformedFileReturnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{ not valid json");

        assertEquals(CraneConfig.defaults(), CraneConfigLoader.load(configFile));
    }

    @Test
    void invalidValuesReturnDefaults() throws IOException {
        Path badPort = tempDir.resolve("port.json");
        Files.writeString(badPort, "{\"masterPort\": 70000}");
        Path badGpus = tempDir.resolve("gpus.json");
        Files.writeString(badGpus, "{\"nodes\": {\"node-0\": {\"gpu_indices\": [-1]}}}");

        assertEquals(CraneConfig.defaults(), CraneConfigLoader.load(badPort));
        assertEquals(CraneConfig.defaults(), CraneConfigLoader.load(badGpus));
    }
}
