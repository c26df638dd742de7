package db.runner.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.runner.exec.SortMergeJoin;

public class EngineConfigTest {
    @TempDir
    Path dir;

    @Test
    void defaultsComeFromBundledResource() {
        EngineConfig cfg = EngineConfig.fromArgs(new String[0]);
        assertEquals(".", cfg.dataDirectory());
        assertEquals("hash", cfg.joinStrategy());
        assertEquals("127.0.0.1", cfg.host());
        assertEquals(9090, cfg.port());
        assertEquals(8, cfg.maxConnections());
        assertEquals(16 * 1024 * 1024, cfg.maxMessageBytes());
    }

    @Test
    void configFileOverridesResourceAndFlagsOverrideFile() throws IOException {
        Path file = dir.resolve("custom.json");
        Files.writeString(file, "{\"joinStrategy\": \"merge\", \"port\": 7000, \"dataDirectory\": \"/srv/data\"}");
        EngineConfig cfg = EngineConfig.fromArgs(new String[] {"server", "--config=" + file, "--port=7100"});
        assertEquals("merge", cfg.joinStrategy());
        assertInstanceOf(SortMergeJoin.class, cfg.newJoinStrategy());
        assertEquals(7100, cfg.port());
        assertEquals("/srv/data", cfg.dataDirectory());
        assertEquals("127.0.0.1", cfg.host());
    }

    @Test
    void flagAliases() {
        EngineConfig cfg = EngineConfig.fromArgs(new String[] {"--data=csv", "--join=merge", "--host=0.0.0.0", "--maxConnections=2"});
        assertEquals("csv", cfg.dataDirectory());
        assertEquals("merge", cfg.joinStrategy());
        assertEquals("0.0.0.0", cfg.host());
        assertEquals(2, cfg.maxConnections());
    }

    @Test
    void absentJsonKeysKeepDefaults() {
        EngineConfig cfg = EngineConfig.fromJson("{\"port\": 0}");
        assertEquals(0, cfg.port());
        assertEquals("hash", cfg.joinStrategy());
        assertEquals(8, cfg.maxConnections());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{\"joinStrategy\": \"loop\"}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{\"port\": 70000}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{\"port\": \"abc\"}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{\"maxConnections\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{\"port\": "));
    }

    @Test
    void badFlagsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromArgs(new String[] {"--port=abc"}));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromArgs(new String[] {"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromArgs(new String[] {"--colour=red"}));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromArgs(new String[] {"--config=" + dir.resolve("none.json")}));
    }

    @Test
    void serializesBackToJson() {
        String json = EngineConfig.defaultConfig().toJson();
        assertTrue(json.contains("\"joinStrategy\": \"hash\""), json);
        assertEquals(EngineConfig.defaultConfig().port(), EngineConfig.fromJson(json).port());
    }
}
