package de.bsommerfeld.fnpack.packager.cache;

import de.bsommerfeld.fnpack.core.domain.ArtifactRecord;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WheelCacheTest {

    private static final String TAG = TargetRuntime.PYTHON36.platformTag();

    @TempDir
    Path tmp;

    private static Path touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "wheel");
    }

    @Test
    void find_shouldLocateNestedWheelByKey() throws IOException {
        Path pip = tmp.resolve("pip");
        Path wheel = touch(pip.resolve("wheels/ab/cd/numpy-1.13.3-" + TAG));
        Distribution numpy = new Distribution("NumPy", "1.13.3", null, List.of());

        ArtifactRecord record = new WheelCache(List.of(pip)).find(numpy, TargetRuntime.PYTHON36, TAG).orElseThrow();

        assertEquals(wheel, record.path());
        assertEquals("numpy", record.name());
    }

    @Test
    void find_shouldMatchFilenameSafeSpelling() throws IOException {
        Path cache = tmp.resolve("private");
        Path wheel = touch(cache.resolve("python_dateutil-2.6.1-" + TAG));
        Distribution dateutil = new Distribution("python-dateutil", "2.6.1", null, List.of());

        assertEquals(wheel, new WheelCache(List.of(cache)).find(dateutil, TargetRuntime.PYTHON36, TAG)
                .orElseThrow().path());
    }

    @Test
    void find_shouldSkipMissingRootsAndPreferEarlierRoots() throws IOException {
        Path first = tmp.resolve("first");
        Path second = tmp.resolve("second");
        Path preferred = touch(first.resolve("six-1.11.0-" + TAG));
        touch(second.resolve("six-1.11.0-" + TAG));
        Distribution six = new Distribution("six", "1.11.0", null, List.of());

        WheelCache cache = new WheelCache(List.of(tmp.resolve("missing"), first, second));

        assertEquals(preferred, cache.find(six, TargetRuntime.PYTHON36, TAG).orElseThrow().path());
    }

    @Test
    void find_shouldIgnoreOtherVersionsAndTags() throws IOException {
        Path cache = tmp.resolve("cache");
        touch(cache.resolve("six-1.10.0-" + TAG));
        touch(cache.resolve("six-1.11.0-" + TargetRuntime.PYTHON27.platformTag()));
        Distribution six = new Distribution("six", "1.11.0", null, List.of());

        assertTrue(new WheelCache(List.of(cache)).find(six, TargetRuntime.PYTHON36, TAG).isEmpty());
    }
}
