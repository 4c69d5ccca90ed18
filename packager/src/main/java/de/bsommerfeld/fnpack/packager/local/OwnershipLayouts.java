package de.bsommerfeld.fnpack.packager.local;

import de.bsommerfeld.fnpack.core.domain.Distribution;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * The installation layouts a local distribution directory can have, in the
 * order they are tried.
 */
final class OwnershipLayouts {

    static final String TOP_LEVEL_FILE = "top_level.txt";
    static final String RECORD_FILE = "RECORD";
    static final String EGG_INFO = "EGG-INFO";

    private OwnershipLayouts() {
    }

    static List<OwnershipLayout> ordered() {
        return List.of(
                OwnershipLayouts::unpackedEgg,
                OwnershipLayouts::adjacentEggInfo,
                OwnershipLayouts::embeddedEggDirectory,
                OwnershipLayouts::distInfo);
    }

    /** {@code foo-1.0-py3.6.egg/EGG-INFO/top_level.txt}, location is the egg itself. */
    static Optional<OwnershipManifest> unpackedEgg(Distribution distribution, Path location) throws IOException {
        if (!lower(location.getFileName()).endsWith(".egg"))
            return Optional.empty();
        return read(location, location.resolve(EGG_INFO).resolve(TOP_LEVEL_FILE));
    }

    /** {@code site-packages/foo.egg-info/top_level.txt} or a versioned variant. */
    static Optional<OwnershipManifest> adjacentEggInfo(Distribution distribution, Path location)
            throws IOException {
        List<Path> folders = new ArrayList<>();
        folders.add(location.resolve(distribution.key() + ".egg-info"));
        folders.add(location.resolve(distribution.filenameSafeName() + ".egg-info"));
        folders.addAll(children(location, versionedPrefix(distribution), ".egg-info"));

        for (Path folder : folders) {
            Optional<OwnershipManifest> manifest = read(location, folder.resolve(TOP_LEVEL_FILE));
            if (manifest.isPresent())
                return manifest;
        }
        return Optional.empty();
    }

    /** {@code site-packages/foo-1.0-py3.6.egg/EGG-INFO/top_level.txt}, sources below the egg directory. */
    static Optional<OwnershipManifest> embeddedEggDirectory(Distribution distribution, Path location)
            throws IOException {
        for (Path egg : children(location, versionedPrefix(distribution), ".egg")) {
            if (!Files.isDirectory(egg))
                continue;
            Optional<OwnershipManifest> manifest = read(egg, egg.resolve(EGG_INFO).resolve(TOP_LEVEL_FILE));
            if (manifest.isPresent())
                return manifest;
        }
        return Optional.empty();
    }

    /** {@code site-packages/foo-1.0.dist-info/}, falling back to its {@code RECORD}. */
    static Optional<OwnershipManifest> distInfo(Distribution distribution, Path location) throws IOException {
        List<Path> folders = List.of(
                location.resolve(distribution.key() + "-" + distribution.version() + ".dist-info"),
                location.resolve(distribution.filenameSafeName() + "-" + distribution.version() + ".dist-info"));

        for (Path folder : folders) {
            if (!Files.isDirectory(folder))
                continue;

            Optional<OwnershipManifest> manifest = read(location, folder.resolve(TOP_LEVEL_FILE));
            if (manifest.isPresent())
                return manifest;

            Path record = folder.resolve(RECORD_FILE);
            if (Files.isRegularFile(record)) {
                List<String> names = OwnershipManifest.deriveFromRecord(
                        Files.readString(record, StandardCharsets.UTF_8));
                if (!names.isEmpty())
                    return Optional.of(new OwnershipManifest(location, names, record.toString()));
            }
        }
        return Optional.empty();
    }

    // =====================================================================
    // Utilities
    // =====================================================================

    /** Lowercased {@code {safeName}-{version}}, the prefix of versioned egg names. */
    static String versionedPrefix(Distribution distribution) {
        return (distribution.filenameSafeName() + "-" + distribution.version()).toLowerCase(Locale.ROOT);
    }

    /** Children of {@code directory} whose lowercased names start with {@code prefix} and end with {@code suffix}, sorted. */
    static List<Path> children(Path directory, String prefix, String suffix) throws IOException {
        if (!Files.isDirectory(directory))
            return List.of();

        Predicate<Path> matches = p -> {
            String name = lower(p.getFileName());
            return name.startsWith(prefix) && name.endsWith(suffix);
        };
        try (Stream<Path> list = Files.list(directory)) {
            return list.filter(matches).sorted().toList();
        }
    }

    private static Optional<OwnershipManifest> read(Path sourceRoot, Path topLevelFile) throws IOException {
        if (!Files.isRegularFile(topLevelFile))
            return Optional.empty();
        List<String> names = OwnershipManifest.parseTopLevel(Files.readString(topLevelFile, StandardCharsets.UTF_8));
        return Optional.of(new OwnershipManifest(sourceRoot, names, topLevelFile.toString()));
    }

    private static String lower(Path fileName) {
        return fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    }
}
