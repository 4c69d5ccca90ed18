package de.bsommerfeld.fnpack.packager.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.fnpack.core.domain.ArtifactRecord;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only store of precompiled packages known to work on the target
 * runtime, keyed by distribution and runtime.
 *
 * <h3>Manifest format</h3>
 * <pre>{@code
 * {
 *   "psycopg2": {
 *     "python2.7": { "version": "2.7.1", "path": "psycopg2/python2.7-psycopg2-2.7.1.tar.gz" },
 *     "python3.6": { "version": "2.7.1", "path": "psycopg2/python3.6-psycopg2-2.7.1.tar.gz" }
 *   }
 * }
 * }</pre>
 * Distribution names are case-folded on load. Relative archive paths
 * resolve against the manifest's directory.
 */
public final class BundledArtifactStore {

    private static final Logger LOG = LoggerFactory.getLogger(BundledArtifactStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * One runtime build of a bundled package.
     *
     * @param version version the archive was built from
     * @param path    tarball location
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String version, String path) {
    }

    private final Map<String, Map<String, Entry>> entries;
    private final Path baseDirectory;

    public BundledArtifactStore(Map<String, Map<String, Entry>> entries, Path baseDirectory) {
        Map<String, Map<String, Entry>> folded = new HashMap<>();
        entries.forEach((name, byRuntime) -> folded.put(Distribution.canonicalize(name), Map.copyOf(byRuntime)));
        this.entries = Map.copyOf(folded);
        this.baseDirectory = baseDirectory;
    }

    public static BundledArtifactStore empty() {
        return new BundledArtifactStore(Map.of(), Path.of("."));
    }

    /**
     * Loads the store from its JSON manifest.
     *
     * @throws IOException if the manifest cannot be read or parsed
     */
    public static BundledArtifactStore load(Path manifest) throws IOException {
        Map<String, Map<String, Entry>> entries = MAPPER.readValue(manifest.toFile(),
                new TypeReference<Map<String, Map<String, Entry>>>() {
                });
        Path base = manifest.toAbsolutePath().getParent();
        LOG.info("Loaded {} bundled packages from {}", entries.size(), manifest);
        return new BundledArtifactStore(entries, base);
    }

    /**
     * Looks up the bundled build of {@code name} for {@code runtime}.
     *
     * @param requireExactVersion when {@code true}, only a build of exactly
     *                            {@code version} matches; otherwise any
     *                            bundled version is accepted
     */
    public Optional<ArtifactRecord> lookup(String name, String version, TargetRuntime runtime,
            boolean requireExactVersion) {
        Map<String, Entry> byRuntime = entries.get(Distribution.canonicalize(name));
        if (byRuntime == null)
            return Optional.empty();

        Entry entry = byRuntime.get(runtime.id());
        if (entry == null || entry.path() == null || entry.version() == null)
            return Optional.empty();
        if (requireExactVersion && !entry.version().equals(version))
            return Optional.empty();

        return Optional.of(new ArtifactRecord(Distribution.canonicalize(name), entry.version(), runtime.id(),
                runtime.platformTag(), baseDirectory.resolve(entry.path())));
    }

    public int size() {
        return entries.size();
    }
}
