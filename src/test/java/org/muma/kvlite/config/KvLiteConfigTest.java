package org.muma.kvlite.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KvLiteConfigTest {

    private static final String TEST_CONFIG = "kvlite-test.properties";

    @Test
    void testBundledDefaults() {
        KvLiteConfig config = KvLiteConfig.load(new String[0], Map.of());

        assertEquals(6379, config.getPort());
        assertEquals("", config.getDir());
        assertEquals("", config.getDbFilename());
        assertFalse(config.hasSnapshot());
    }

    @Test
    void testLoadFromPropertiesFile() {
        KvLiteConfig config = KvLiteConfig.load(new String[]{"--config", TEST_CONFIG}, Map.of());

        assertEquals(7001, config.getPort());
        assertEquals("/var/lib/kvlite", config.getDir());
        assertEquals("from-file.rdb", config.getDbFilename());
        assertTrue(config.hasSnapshot());
        assertEquals(Paths.get("/var/lib/kvlite", "from-file.rdb"), config.snapshotPath());
    }

    @Test
    void testEnvOverridesFile() {
        Map<String, String> env = Map.of(
                "KVLITE_PORT", "7002",
                "KVLITE_DIR", "/env/dir");

        KvLiteConfig config = KvLiteConfig.load(new String[]{"--config", TEST_CONFIG}, env);

        assertEquals(7002, config.getPort());
        assertEquals("/env/dir", config.getDir());
        // 未被环境变量覆盖的项保持文件里的值
        assertEquals("from-file.rdb", config.getDbFilename());
    }

    @Test
    void testArgsOverrideEnv() {
        Map<String, String> env = Map.of(
                "KVLITE_PORT", "7002",
                "KVLITE_DIR", "/env/dir",
                "KVLITE_DBFILENAME", "env.rdb");
        String[] args = {"--config", TEST_CONFIG, "--port", "7003", "--dir", "/tmp/redis-files", "--dbfilename", "dump.rdb"};

        KvLiteConfig config = KvLiteConfig.load(args, env);

        assertEquals(7003, config.getPort());
        assertEquals("/tmp/redis-files", config.getDir());
        assertEquals("dump.rdb", config.getDbFilename());
    }

    @Test
    void testInvalidPortKeepsPreviousValue() {
        KvLiteConfig config = KvLiteConfig.load(
                new String[]{"--config", TEST_CONFIG, "--port", "not-a-port"},
                Map.of("KVLITE_PORT", "also-bad"));

        assertEquals(7001, config.getPort());
    }

    @Test
    void testMissingConfigFileFallsBackToDefaults() {
        KvLiteConfig config = KvLiteConfig.load(new String[]{"--config", "no-such-file.properties"}, Map.of());

        assertEquals(KvLiteConfig.DEFAULT_PORT, config.getPort());
        assertFalse(config.hasSnapshot());
    }

    @Test
    void testParseArgsIgnoresUnknownAndDanglingFlags() {
        Map<String, String> flags = KvLiteConfig.parseArgs(
                new String[]{"stray", "--verbose", "--dir", "/data", "--port"});

        assertEquals(Map.of("dir", "/data"), flags);
    }

    @Test
    void testHasSnapshotNeedsBothParts() {
        assertFalse(new KvLiteConfig(6379, "/data", "").hasSnapshot());
        assertFalse(new KvLiteConfig(6379, "", "dump.rdb").hasSnapshot());
        assertFalse(new KvLiteConfig(6379, null, null).hasSnapshot());
        assertTrue(new KvLiteConfig(6379, "/data", "dump.rdb").hasSnapshot());
    }
}
