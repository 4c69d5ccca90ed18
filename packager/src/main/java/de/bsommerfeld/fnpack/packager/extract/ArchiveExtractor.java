package de.bsommerfeld.fnpack.packager.extract;

import de.bsommerfeld.fnpack.core.domain.IgnorePatternSet;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts zip-based artifacts (wheels, eggs) and gzipped tarballs (bundled
 * precompiled packages) into the staging tree.
 *
 * <h3>Filtering</h3>
 * Every entry passes the {@link IgnorePatternSet} before it is written;
 * callers can narrow the selection further with an entry-name predicate.
 * Directory entries are never materialized on their own, parent directories
 * are created for the files that land in them.
 *
 * <h3>Path safety</h3>
 * Entry names are normalized to {@code /} separators with leading slashes
 * stripped, then resolved against the destination. An entry that would
 * escape the destination ({@code ../../etc/passwd}) aborts the extraction.
 */
public final class ArchiveExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveExtractor.class);

    private final IgnorePatternSet ignore;

    public ArchiveExtractor(IgnorePatternSet ignore) {
        this.ignore = ignore;
    }

    /**
     * Extracts by file type: {@code .tar.gz} and {@code .tgz} as gzipped
     * tarballs, everything else as zip.
     *
     * @return number of files written
     */
    public int extract(Path archive, Path destination) throws IOException {
        return isTarball(archive) ? extractTarGz(archive, destination) : extractZip(archive, destination, n -> true);
    }

    /**
     * Extracts the zip entries accepted by {@code selection} and not ignored.
     *
     * @return number of files written
     */
    public int extractZip(Path archive, Path destination, Predicate<String> selection) throws IOException {
        int written = 0;
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory())
                    continue;

                String name = normalize(entry.getName());
                if (!accepts(name, selection))
                    continue;

                try (InputStream in = zip.getInputStream(entry)) {
                    write(in, resolveSafely(destination, name));
                }
                written++;
            }
        }
        LOG.debug("Extracted {} files from {}", written, archive.getFileName());
        return written;
    }

    /**
     * Extracts the regular files of a gzipped tarball. Links and special
     * files are skipped.
     *
     * @return number of files written
     */
    public int extractTarGz(Path archive, Path destination) throws IOException {
        int written = 0;
        try (InputStream file = new BufferedInputStream(Files.newInputStream(archive));
                GzipCompressorInputStream gzip = new GzipCompressorInputStream(file);
                TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {

            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (entry.isDirectory())
                    continue;
                if (!entry.isFile()) {
                    LOG.debug("Skipping non-regular tar entry {}", entry.getName());
                    continue;
                }

                String name = normalize(entry.getName());
                if (!accepts(name, n -> true))
                    continue;

                write(tar, resolveSafely(destination, name));
                written++;
            }
        }
        LOG.debug("Extracted {} files from {}", written, archive.getFileName());
        return written;
    }

    public IgnorePatternSet ignorePatterns() {
        return ignore;
    }

    // =====================================================================
    // Utilities
    // =====================================================================

    private boolean accepts(String name, Predicate<String> selection) {
        return !name.isEmpty() && !ignore.matches(name) && selection.test(name);
    }

    private static void write(InputStream in, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    }

    /** Backslashes become {@code /}, leading separators and {@code ./} are dropped. */
    public static String normalize(String entryName) {
        String name = entryName.replace('\\', '/');
        while (name.startsWith("/") || name.startsWith("./")) {
            name = name.startsWith("/") ? name.substring(1) : name.substring(2);
        }
        return name;
    }

    /**
     * Resolves an entry name inside {@code root}.
     *
     * @throws IOException if the resolved path leaves {@code root}
     */
    static Path resolveSafely(Path root, String entryName) throws IOException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path target = normalizedRoot.resolve(entryName).normalize();
        if (!target.startsWith(normalizedRoot) || target.equals(normalizedRoot)) {
            throw new IOException("Archive entry escapes destination: " + entryName);
        }
        return target;
    }

    private static boolean isTarball(Path archive) {
        String name = archive.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".tar.gz") || name.endsWith(".tgz");
    }
}
