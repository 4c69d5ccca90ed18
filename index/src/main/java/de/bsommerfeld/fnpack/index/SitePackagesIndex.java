package de.bsommerfeld.fnpack.index;

import de.bsommerfeld.fnpack.core.domain.Distribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * {@link PackageIndex} built by scanning the directories of an interpreter's
 * search path for installed-distribution metadata.
 *
 * <h3>Recognized layouts</h3>
 * <ul>
 * <li>{@code name-1.0.dist-info/METADATA}: wheel installs</li>
 * <li>{@code name-1.0-py3.6.egg-info/} with {@code PKG-INFO} and
 * {@code requires.txt}, or a single {@code .egg-info} file: setuptools
 * and distutils installs</li>
 * <li>{@code name-1.0-py3.6.egg/EGG-INFO/}: unpacked eggs</li>
 * <li>{@code name-1.0-py3.6.egg} zip files: legacy bundles</li>
 * <li>{@code name.egg-link}: develop installs pointing at a project
 * directory that holds {@code name.egg-info}</li>
 * </ul>
 *
 * <h3>Locations</h3>
 * The location recorded for a distribution is where its importable code
 * lives: the search path directory for {@code .dist-info} and
 * {@code .egg-info}, the egg itself for eggs, and the project directory for
 * develop installs.
 *
 * <p>
 * The first search path directory that provides a key wins, mirroring
 * import precedence. Unreadable metadata is logged and skipped.
 */
public final class SitePackagesIndex implements PackageIndex {

    private static final Logger LOG = LoggerFactory.getLogger(SitePackagesIndex.class);

    private static final String DIST_INFO = ".dist-info";
    private static final String EGG_INFO = ".egg-info";
    private static final String EGG = ".egg";
    private static final String EGG_LINK = ".egg-link";

    private final Map<String, Distribution> byKey;

    private SitePackagesIndex(Map<String, Distribution> byKey) {
        this.byKey = Collections.unmodifiableMap(byKey);
    }

    /**
     * Scans every existing directory of the search path, in order.
     * Requirements are recorded only where their environment marker holds.
     *
     * @throws IOException if a search path directory cannot be listed
     */
    public static SitePackagesIndex scan(List<Path> searchPath, MarkerEnvironment environment) throws IOException {
        Map<String, Distribution> found = new LinkedHashMap<>();
        for (Path dir : searchPath) {
            if (!Files.isDirectory(dir)) {
                LOG.debug("Skipping search path entry {}: not a directory", dir);
                continue;
            }
            for (Path entry : listSorted(dir)) {
                readEntry(dir, entry, environment).ifPresent(d -> {
                    if (found.putIfAbsent(d.key(), d) == null) {
                        LOG.debug("Indexed {} at {}", d, d.location());
                    }
                });
            }
        }
        LOG.info("Indexed {} installed distributions", found.size());
        return new SitePackagesIndex(found);
    }

    @Override
    public Optional<Distribution> find(String name) {
        return Optional.ofNullable(byKey.get(Distribution.canonicalize(name)));
    }

    public Collection<Distribution> distributions() {
        return byKey.values();
    }

    // =====================================================================
    // Entry Dispatch
    // =====================================================================

    private static Optional<Distribution> readEntry(Path dir, Path entry, MarkerEnvironment environment) {
        String fileName = entry.getFileName().toString();
        try {
            if (fileName.endsWith(DIST_INFO) && Files.isDirectory(entry)) {
                return readDistInfo(dir, entry, environment);
            }
            if (fileName.endsWith(EGG_INFO)) {
                return Files.isDirectory(entry)
                        ? readEggInfoDirectory(entry, dir, fileName, environment)
                        : readPkgInfo(Files.readString(entry, StandardCharsets.UTF_8), List.of(), dir, fileName);
            }
            if (fileName.endsWith(EGG)) {
                return Files.isDirectory(entry)
                        ? readEggInfoDirectory(entry.resolve("EGG-INFO"), entry, fileName, environment)
                        : readZippedEgg(entry, environment);
            }
            if (fileName.endsWith(EGG_LINK) && Files.isRegularFile(entry)) {
                return readEggLink(dir, entry, environment);
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Skipping unreadable distribution metadata {}: {}", entry, e.getMessage());
        }
        return Optional.empty();
    }

    // =====================================================================
    // Layout Readers
    // =====================================================================

    private static Optional<Distribution> readDistInfo(Path dir, Path distInfo, MarkerEnvironment environment)
            throws IOException {
        Path metadata = distInfo.resolve("METADATA");
        if (!Files.isRegularFile(metadata))
            return Optional.empty();

        Map<String, List<String>> headers = MetadataReader.parseHeaders(
                Files.readString(metadata, StandardCharsets.UTF_8));
        return build(headers, MetadataReader.requiresDist(headers, environment), dir, distInfo.getFileName().toString());
    }

    private static Optional<Distribution> readEggInfoDirectory(Path eggInfo, Path location, String metadataName,
            MarkerEnvironment environment) throws IOException {
        Path pkgInfo = eggInfo.resolve("PKG-INFO");
        if (!Files.isRegularFile(pkgInfo))
            return Optional.empty();

        Path requiresTxt = eggInfo.resolve("requires.txt");
        List<String> requirements = Files.isRegularFile(requiresTxt)
                ? MetadataReader.requiresTxt(Files.readString(requiresTxt, StandardCharsets.UTF_8), environment)
                : List.of();
        return readPkgInfo(Files.readString(pkgInfo, StandardCharsets.UTF_8), requirements, location, metadataName);
    }

    private static Optional<Distribution> readZippedEgg(Path egg, MarkerEnvironment environment) throws IOException {
        try (ZipFile zip = new ZipFile(egg.toFile())) {
            String pkgInfo = readZipText(zip, "EGG-INFO/PKG-INFO");
            if (pkgInfo == null)
                return Optional.empty();
            String requiresTxt = readZipText(zip, "EGG-INFO/requires.txt");
            List<String> requirements = requiresTxt == null ? List.of() : MetadataReader.requiresTxt(requiresTxt, environment);
            return readPkgInfo(pkgInfo, requirements, egg, egg.getFileName().toString());
        }
    }

    /**
     * The first line of an {@code .egg-link} names the project directory,
     * relative to the search path directory or absolute.
     */
    private static Optional<Distribution> readEggLink(Path dir, Path eggLink, MarkerEnvironment environment)
            throws IOException {
        List<String> lines = Files.readAllLines(eggLink, StandardCharsets.UTF_8);
        if (lines.isEmpty() || lines.get(0).isBlank())
            return Optional.empty();

        Path projectDir = dir.resolve(lines.get(0).strip()).normalize();
        if (!Files.isDirectory(projectDir))
            return Optional.empty();

        for (Path candidate : listSorted(projectDir)) {
            if (candidate.getFileName().toString().endsWith(EGG_INFO) && Files.isDirectory(candidate)) {
                return readEggInfoDirectory(candidate, projectDir, candidate.getFileName().toString(), environment);
            }
        }
        return Optional.empty();
    }

    private static Optional<Distribution> readPkgInfo(String content, List<String> requirements, Path location,
            String metadataName) {
        return build(MetadataReader.parseHeaders(content), requirements, location, metadataName);
    }

    /**
     * Builds the distribution from its headers, falling back to the
     * {@code name-version...} spelling of the metadata folder when a header
     * is missing.
     */
    private static Optional<Distribution> build(Map<String, List<String>> headers, List<String> requirements,
            Path location, String metadataName) {
        String name = MetadataReader.first(headers, "Name");
        String version = MetadataReader.first(headers, "Version");

        int dot = metadataName.lastIndexOf('.');
        String stem = dot > 0 ? metadataName.substring(0, dot) : metadataName;
        String[] parts = stem.split("-");
        if (name == null || name.isBlank())
            name = parts[0];
        if ((version == null || version.isBlank()) && parts.length > 1)
            version = parts[1];
        if (name.isBlank() || version == null || version.isBlank())
            return Optional.empty();

        return Optional.of(new Distribution(name, version, location, requirements));
    }

    // =====================================================================
    // Utilities
    // =====================================================================

    private static List<Path> listSorted(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted().toList();
        }
    }

    private static String readZipText(ZipFile zip, String name) throws IOException {
        ZipEntry entry = zip.getEntry(name);
        if (entry == null)
            return null;
        try (InputStream in = zip.getInputStream(entry)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
