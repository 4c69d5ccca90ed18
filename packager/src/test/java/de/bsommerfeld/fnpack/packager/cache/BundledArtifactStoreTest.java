package de.bsommerfeld.fnpack.packager.cache;

import de.bsommerfeld.fnpack.core.domain.ArtifactRecord;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BundledArtifactStoreTest {

    @TempDir
    Path dir;

    private BundledArtifactStore loadStore() throws IOException {
        Path manifest = dir.resolve("bundled.json");
        Files.writeString(manifest, """
                {
                  "Psycopg2": {
                    "python3.6": { "version": "2.7.1", "path": "psycopg2/python3.6-psycopg2-2.7.1.tar.gz" },
                    "python2.7": { "version": "2.7.1", "path": "psycopg2/python2.7-psycopg2-2.7.1.tar.gz" }
                  }
                }
                """);
        return BundledArtifactStore.load(manifest);
    }

    @Test
    void lookup_shouldFindExactVersionCaseInsensitively() throws IOException {
        ArtifactRecord record = loadStore().lookup("PSYCOPG2", "2.7.1", TargetRuntime.PYTHON36, true)
                .orElseThrow();

        assertEquals("psycopg2", record.name());
        assertEquals("python3.6", record.runtime());
        assertEquals(dir.toAbsolutePath().resolve("psycopg2/python3.6-psycopg2-2.7.1.tar.gz"), record.path());
    }

    @Test
    void lookup_shouldRejectOtherVersionWhenExact() throws IOException {
        assertTrue(loadStore().lookup("psycopg2", "2.7.3", TargetRuntime.PYTHON36, true).isEmpty());
    }

    @Test
    void lookup_shouldAcceptOtherVersionWhenNotExact() throws IOException {
        ArtifactRecord record = loadStore().lookup("psycopg2", "2.7.3", TargetRuntime.PYTHON36, false)
                .orElseThrow();

        assertEquals("2.7.1", record.version());
    }

    @Test
    void lookup_shouldMissUnknownPackages() throws IOException {
        assertTrue(loadStore().lookup("numpy", "1.13.3", TargetRuntime.PYTHON36, false).isEmpty());
        assertTrue(BundledArtifactStore.empty().lookup("psycopg2", "2.7.1", TargetRuntime.PYTHON36, false)
                .isEmpty());
    }
}
