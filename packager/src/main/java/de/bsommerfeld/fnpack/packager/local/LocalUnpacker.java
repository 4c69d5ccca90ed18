package de.bsommerfeld.fnpack.packager.local;

import com.google.inject.Singleton;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.IgnorePatternSet;
import de.bsommerfeld.fnpack.core.domain.PythonLayout;
import de.bsommerfeld.fnpack.core.error.LocalLayoutException;
import de.bsommerfeld.fnpack.core.error.OwnershipManifestMissingException;
import de.bsommerfeld.fnpack.core.error.UnsupportedLocalLayoutException;
import de.bsommerfeld.fnpack.packager.extract.ArchiveExtractor;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Copies the files of a locally installed distribution into the staging
 * tree.
 *
 * <p>
 * Which files belong to a distribution is decided by its ownership
 * manifest ({@code top_level.txt}), tried in turn through {@link OwnershipLayouts}.
 * Legacy {@code .egg} zip bundles are extracted member by member; compiled
 * members win over their sources.
 *
 * <h3>Module files</h3>
 * A top-level name that is not a directory stands for module files next to
 * it: {@code six.py}, {@code six.pyc} or an extension module such as
 * {@code _cffi_backend.cpython-36m-x86_64-linux-gnu.so}.
 */
@Singleton
public class LocalUnpacker {

    private static final Logger LOG = LoggerFactory.getLogger(LocalUnpacker.class);

    private static final String EGG_SUFFIX = ".egg";
    private static final String BUNDLE_MANIFEST = OwnershipLayouts.EGG_INFO + "/" + OwnershipLayouts.TOP_LEVEL_FILE;

    private final IgnorePatternSet ignore;
    private final ArchiveExtractor extractor;

    @Inject
    public LocalUnpacker(ArchiveExtractor extractor) {
        this.extractor = extractor;
        this.ignore = extractor.ignorePatterns();
    }

    /**
     * Unpacks {@code distribution} from its install location.
     *
     * @throws UnsupportedLocalLayoutException    if the location is missing or
     *                                            of an unknown kind
     * @throws OwnershipManifestMissingException if no ownership manifest is
     *                                            found
     */
    public void unpackLocal(Path stagingTree, Distribution distribution) throws LocalLayoutException, IOException {
        if (!distribution.hasLocation() || !Files.exists(distribution.location()))
            throw new UnsupportedLocalLayoutException("No local installation of " + distribution);

        Path location = distribution.location();
        if (Files.isRegularFile(location)) {
            if (!isEgg(location))
                throw new UnsupportedLocalLayoutException("Unsupported local layout for " + distribution + ": "
                        + location);
            unpackBundle(stagingTree, location, distribution);
            return;
        }

        Optional<Path> bundle = embeddedBundle(location, distribution);
        if (bundle.isPresent()) {
            unpackBundle(stagingTree, bundle.get(), distribution);
            return;
        }

        OwnershipManifest manifest = findManifest(location, distribution);
        LOG.debug("Ownership of {} from {}: {}", distribution, manifest.origin(), manifest.topLevel());
        for (String top : manifest.topLevel()) {
            copyTopLevel(manifest.sourceRoot(), top, stagingTree);
        }
    }

    // =====================================================================
    // Directory layouts
    // =====================================================================

    private OwnershipManifest findManifest(Path location, Distribution distribution)
            throws OwnershipManifestMissingException, IOException {
        for (OwnershipLayout layout : OwnershipLayouts.ordered()) {
            Optional<OwnershipManifest> manifest = layout.detect(distribution, location);
            if (manifest.isPresent())
                return manifest.get();
        }
        throw new OwnershipManifestMissingException(
                "No " + OwnershipLayouts.TOP_LEVEL_FILE + " found for " + distribution + " in " + location);
    }

    private Optional<Path> embeddedBundle(Path location, Distribution distribution) throws IOException {
        return OwnershipLayouts.children(location, OwnershipLayouts.versionedPrefix(distribution), EGG_SUFFIX)
                .stream()
                .filter(Files::isRegularFile)
                .findFirst();
    }

    private void copyTopLevel(Path sourceRoot, String top, Path stagingTree) throws IOException {
        Path source = sourceRoot.resolve(top);
        if (Files.isDirectory(source)) {
            copyTree(sourceRoot, source, stagingTree);
            return;
        }

        Path parent = source.getParent();
        String module = source.getFileName().toString();
        if (!Files.isDirectory(parent)) {
            LOG.warn("Top-level name {} not found below {}", top, sourceRoot);
            return;
        }

        List<Path> files;
        try (Stream<Path> list = Files.list(parent)) {
            files = list.filter(Files::isRegularFile)
                    .filter(p -> isModuleFile(p.getFileName().toString(), module))
                    .sorted()
                    .toList();
        }
        if (files.isEmpty())
            LOG.warn("Top-level name {} not found below {}", top, sourceRoot);

        for (Path file : files) {
            copyFile(sourceRoot, file, stagingTree);
        }
    }

    private void copyTree(Path sourceRoot, Path source, Path stagingTree) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                return ignore.matches(relative(sourceRoot, dir)) ? FileVisitResult.SKIP_SUBTREE
                        : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                copyFile(sourceRoot, file, stagingTree);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void copyFile(Path sourceRoot, Path file, Path stagingTree) throws IOException {
        String relative = relative(sourceRoot, file);
        if (ignore.matches(relative))
            return;

        Path target = stagingTree.resolve(relative);
        Files.createDirectories(target.getParent());
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
    }

    // =====================================================================
    // Legacy bundles
    // =====================================================================

    private void unpackBundle(Path stagingTree, Path bundle, Distribution distribution)
            throws LocalLayoutException, IOException {
        Set<String> selected;
        try {
            selected = selectBundleMembers(bundle, distribution);
        } catch (ZipException e) {
            throw new UnsupportedLocalLayoutException("Unreadable egg bundle " + bundle, e);
        }

        int written = extractor.extractZip(bundle, stagingTree, selected::contains);
        LOG.debug("Unpacked {} of {} members from {}", written, selected.size(), bundle.getFileName());
    }

    /**
     * Picks the members of an egg bundle that belong into the staging tree.
     */
    Set<String> selectBundleMembers(Path bundle, Distribution distribution)
            throws OwnershipManifestMissingException, IOException {
        try (ZipFile zip = new ZipFile(bundle.toFile())) {
            ZipEntry manifestEntry = zip.getEntry(BUNDLE_MANIFEST);
            if (manifestEntry == null)
                throw new OwnershipManifestMissingException(
                        "No " + BUNDLE_MANIFEST + " in " + bundle + " for " + distribution);

            List<String> tops;
            try (InputStream in = zip.getInputStream(manifestEntry)) {
                tops = OwnershipManifest.parseTopLevel(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }

            Set<String> members = new HashSet<>();
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!entry.isDirectory())
                    members.add(ArchiveExtractor.normalize(entry.getName()));
            }

            Set<String> selected = new HashSet<>();
            for (String member : members) {
                if (!ownedByAny(member, tops) || ignore.matches(member))
                    continue;
                if (PythonLayout.isSource(member) && members.contains(PythonLayout.compiledSibling(member)))
                    continue;
                selected.add(member);
            }
            return selected;
        }
    }

    private static boolean ownedByAny(String member, List<String> tops) {
        for (String top : tops) {
            if (member.startsWith(top + "/"))
                return true;

            int slash = top.lastIndexOf('/');
            String parent = slash < 0 ? "" : top.substring(0, slash + 1);
            String module = top.substring(slash + 1);
            if (member.startsWith(parent) && member.indexOf('/', parent.length()) < 0
                    && isModuleFile(member.substring(parent.length()), module)) {
                return true;
            }
        }
        return false;
    }

    // =====================================================================
    // Utilities
    // =====================================================================

    /** {@code mod.py}, {@code mod.pyc} or an extension module {@code mod.*.so}/{@code mod.*.pyd}. */
    static boolean isModuleFile(String fileName, String module) {
        if (fileName.equals(module + PythonLayout.SOURCE_SUFFIX)
                || fileName.equals(module + PythonLayout.COMPILED_SUFFIX)) {
            return true;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return fileName.startsWith(module + ".") && (lower.endsWith(".so") || lower.endsWith(".pyd"));
    }

    private static boolean isEgg(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EGG_SUFFIX);
    }

    private static String relative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
