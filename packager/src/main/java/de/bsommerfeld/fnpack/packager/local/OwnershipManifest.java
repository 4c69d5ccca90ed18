package de.bsommerfeld.fnpack.packager.local;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The top-level names a distribution owns, and the directory they live in.
 *
 * @param sourceRoot directory the top-level names are relative to
 * @param topLevel   importable top-level packages and modules, in manifest order
 * @param origin     file the names were read from, for logging
 */
public record OwnershipManifest(Path sourceRoot, List<String> topLevel, String origin) {

    public OwnershipManifest {
        topLevel = List.copyOf(topLevel);
    }

    /** Parses a {@code top_level.txt}: one name per line, blanks ignored. */
    public static List<String> parseTopLevel(String content) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : content.split("\\R")) {
            String name = line.strip().replace('\\', '/');
            while (name.endsWith("/"))
                name = name.substring(0, name.length() - 1);
            if (!name.isEmpty())
                names.add(name);
        }
        return new ArrayList<>(names);
    }

    /**
     * Derives top-level names from a distribution-info {@code RECORD} file.
     *
     * <p>
     * The first path segment of every recorded file is taken; files at the
     * root contribute their module name ({@code six.py} gives {@code six},
     * {@code _cffi_backend.cpython-36m-x86_64-linux-gnu.so} gives
     * {@code _cffi_backend}). Metadata folders, parent references and
     * {@code __pycache__} are skipped.
     */
    public static List<String> deriveFromRecord(String record) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : record.split("\\R")) {
            String path = firstField(line.strip()).replace('\\', '/');
            if (path.isEmpty() || path.startsWith("/") || path.startsWith(".."))
                continue;

            int slash = path.indexOf('/');
            String top = slash < 0 ? moduleName(path) : path.substring(0, slash);
            if (top.isEmpty() || isMetadataFolder(top) || top.equals("__pycache__"))
                continue;
            if (slash < 0 && !isModuleFile(path))
                continue;

            names.add(top);
        }
        return new ArrayList<>(names);
    }

    // =====================================================================
    // RECORD parsing
    // =====================================================================

    /** First CSV field, honouring double quotes. */
    static String firstField(String line) {
        if (!line.startsWith("\"")) {
            int comma = line.indexOf(',');
            return comma < 0 ? line : line.substring(0, comma);
        }

        StringBuilder field = new StringBuilder();
        for (int i = 1; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    field.append('"');
                    i++;
                } else {
                    break;
                }
            } else {
                field.append(c);
            }
        }
        return field.toString();
    }

    private static String moduleName(String fileName) {
        int dot = fileName.indexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }

    private static boolean isMetadataFolder(String segment) {
        String lower = segment.toLowerCase(Locale.ROOT);
        return lower.endsWith(".dist-info") || lower.endsWith(".egg-info") || lower.endsWith(".data");
    }

    private static boolean isModuleFile(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".py") || lower.endsWith(".pyc") || lower.endsWith(".so") || lower.endsWith(".pyd");
    }
}
