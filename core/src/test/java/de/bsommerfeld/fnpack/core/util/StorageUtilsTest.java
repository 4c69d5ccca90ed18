package de.bsommerfeld.fnpack.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldBeAbsolute() {
        assertTrue(StorageUtils.getAppDataDir("test-app").isAbsolute());
    }

    @Test
    void getConfigFile_shouldLiveInAppDataDir() {
        Path config = StorageUtils.getConfigFile();

        assertEquals(StorageUtils.getAppDataDir(StorageUtils.APP_NAME), config.getParent());
        assertEquals("config.json", config.getFileName().toString());
    }

    @Test
    void getPipCacheDir_shouldEndInPipDirectory() {
        Path dir = StorageUtils.getPipCacheDir();
        String os = System.getProperty("os.name", "").toLowerCase();

        if (os.contains("win")) {
            assertEquals("Cache", dir.getFileName().toString());
        } else {
            assertEquals("pip", dir.getFileName().toString());
        }
    }

    @Test
    void getPrivateCacheDir_shouldLiveInTempDir() {
        Path dir = StorageUtils.getPrivateCacheDir();

        assertEquals(Path.of(System.getProperty("java.io.tmpdir")), dir.getParent());
        assertEquals("fnpack_cache", dir.getFileName().toString());
    }
}
