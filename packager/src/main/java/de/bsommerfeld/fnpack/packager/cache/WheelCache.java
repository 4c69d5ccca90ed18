package de.bsommerfeld.fnpack.packager.cache;

import de.bsommerfeld.fnpack.core.domain.ArtifactRecord;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Portable binary wheels found on disk, in pip's cache or the packager's
 * private download cache.
 *
 * <p>
 * Nothing is indexed between lookups: every {@link #find} walks the cache
 * roots again, so wheels downloaded earlier in the same run are visible.
 * Roots are consulted in order and a root that does not exist is skipped.
 *
 * <h3>Naming convention</h3>
 * A wheel matches when its filename is
 * {@code {name}-{version}-{platformTag}}, with the name spelled either as
 * the canonical key or in its filename-safe form
 * ({@code python_dateutil}).
 */
public final class WheelCache {

    private static final Logger LOG = LoggerFactory.getLogger(WheelCache.class);

    private static final String WHEEL_SUFFIX = ".whl";

    private final List<Path> roots;

    public WheelCache(List<Path> roots) {
        this.roots = List.copyOf(roots);
    }

    public Optional<ArtifactRecord> find(Distribution dependency, TargetRuntime runtime, String platformTag)
            throws IOException {
        List<String> candidates = candidateNames(dependency, platformTag);
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                LOG.debug("Wheel cache {} does not exist", root);
                continue;
            }

            Map<String, Path> wheels = scan(root);
            for (String candidate : candidates) {
                Path wheel = wheels.get(candidate);
                if (wheel != null) {
                    return Optional.of(new ArtifactRecord(dependency.key(), dependency.version(), runtime.id(),
                            platformTag, wheel));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Collects every {@code .whl} file below {@code root}, keyed by filename.
     * The first file found under a name wins.
     */
    static Map<String, Path> scan(Path root) throws IOException {
        Map<String, Path> wheels = new LinkedHashMap<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(WHEEL_SUFFIX))
                    .sorted()
                    .forEach(p -> wheels.putIfAbsent(p.getFileName().toString(), p));
        }
        return wheels;
    }

    static List<String> candidateNames(Distribution dependency, String platformTag) {
        String byKey = TargetRuntime.wheelFileName(dependency.key(), dependency.version(), platformTag);
        String bySafeName = TargetRuntime.wheelFileName(dependency.filenameSafeName(), dependency.version(),
                platformTag);
        return byKey.equals(bySafeName) ? List.of(byKey) : List.of(byKey, bySafeName);
    }
}
