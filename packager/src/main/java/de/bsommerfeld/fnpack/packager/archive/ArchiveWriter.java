package de.bsommerfeld.fnpack.packager.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes a staging tree into a deflated zip archive.
 *
 * <p>
 * Entries are the tree's regular files in sorted order, named by their
 * path relative to the tree root with {@code /} separators. No directory
 * entries are written. With reproducible output every entry carries the
 * same timestamp, so equal trees give byte-identical archives.
 */
public class ArchiveWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveWriter.class);

    /** Earliest DOS time, 1980-01-01 00:00 as wall clock so the stored field is zone independent. */
    static final LocalDateTime FIXED_TIME = LocalDateTime.of(1980, 1, 1, 0, 0);

    private final boolean reproducible;

    public ArchiveWriter(boolean reproducible) {
        this.reproducible = reproducible;
    }

    /**
     * @return number of archived files
     */
    public int write(Path stagingTree, Path outputPath) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(stagingTree)) {
            files = walk.filter(Files::isRegularFile)
                    .sorted((a, b) -> entryName(stagingTree, a).compareTo(entryName(stagingTree, b)))
                    .toList();
        }

        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(outputPath));
                ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.setMethod(ZipOutputStream.DEFLATED);
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);

            for (Path file : files) {
                ZipEntry entry = new ZipEntry(entryName(stagingTree, file));
                entry.setTime(reproducible ? fixedTimeMillis() : Files.getLastModifiedTime(file).toMillis());
                zip.putNextEntry(entry);
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }

        LOG.info("Wrote {} files to {}", files.size(), outputPath);
        return files.size();
    }

    static long fixedTimeMillis() {
        return FIXED_TIME.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }

    static String entryName(Path root, Path file) {
        String name = root.relativize(file).toString().replace('\\', '/');
        while (name.startsWith("/"))
            name = name.substring(1);
        return name;
    }
}
