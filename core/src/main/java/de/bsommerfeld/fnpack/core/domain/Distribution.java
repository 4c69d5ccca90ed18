package de.bsommerfeld.fnpack.core.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An installed distribution as reported by the installed-package index.
 *
 * <p>
 * Identity is the pair of canonical key and version. The key folds the
 * project name the same way the Python packaging tools do: every run of
 * characters outside {@code [A-Za-z0-9.]} becomes a single {@code -}, and
 * the result is lower-cased. {@code Zope_Interface} and
 * {@code zope-interface} therefore name the same distribution.
 *
 * @param name         project name as declared in the distribution metadata
 * @param version      installed version string, compared verbatim
 * @param location     directory or legacy bundle file that holds the installed
 *                     code; {@code null} when the index cannot tell
 * @param requirements names of the distributions this one requires
 */
public record Distribution(String name, String version, Path location, List<String> requirements) {

    private static final Pattern UNSAFE_RUN = Pattern.compile("[^A-Za-z0-9.]+");

    public Distribution {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }

    /** Case-folded key used for lookups and deduplication. */
    public String key() {
        return canonicalize(name);
    }

    /**
     * Returns the key with {@code -} replaced by {@code _}. Metadata folders
     * ({@code .egg-info}, {@code .dist-info}) and wheel filenames use this
     * spelling.
     */
    public String filenameSafeName() {
        return key().replace('-', '_');
    }

    public boolean hasLocation() {
        return location != null;
    }

    /**
     * Folds a project or requirement name into its canonical key.
     */
    public static String canonicalize(String name) {
        return UNSAFE_RUN.matcher(name.strip()).replaceAll("-").toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Distribution other))
            return false;
        return key().equals(other.key()) && version.equals(other.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key(), version);
    }

    @Override
    public String toString() {
        return key() + "==" + version;
    }
}
