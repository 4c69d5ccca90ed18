package de.bsommerfeld.fnpack.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single declared requirement line, reduced to what dependency walking
 * needs: the project name and the environment marker guarding it.
 *
 * <p>
 * Accepts both {@code Requires-Dist} values ({@code idna (<2.7,>=2.5)},
 * {@code PySocks!=1.5.7,>=1.5.6; extra == 'socks'}) and {@code requires.txt}
 * lines ({@code chardet>=3.0.2,<3.1.0}). Version specifiers are dropped;
 * installed distributions are packaged as pinned.
 *
 * @param name   project name as written
 * @param marker text after the {@code ;}, or {@code null} if unguarded
 */
record Requirement(String name, String marker) {

    private static final Logger LOG = LoggerFactory.getLogger(Requirement.class);

    private static final Pattern NAME = Pattern.compile("^\\s*([A-Za-z0-9][A-Za-z0-9._-]*)");

    /**
     * Parses one requirement line. Blank lines and comments yield an empty
     * result.
     */
    static Optional<Requirement> parse(String line) {
        if (line == null)
            return Optional.empty();
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#"))
            return Optional.empty();

        Matcher m = NAME.matcher(trimmed);
        if (!m.find())
            return Optional.empty();

        int markerStart = trimmed.indexOf(';');
        String marker = markerStart == -1 ? null : trimmed.substring(markerStart + 1).strip();
        return Optional.of(new Requirement(m.group(1), marker == null || marker.isEmpty() ? null : marker));
    }

    /**
     * Whether the requirement has to be installed in the given environment.
     * Markers that cannot be parsed are treated as holding.
     */
    boolean appliesTo(MarkerEnvironment environment) {
        return holds(marker, environment);
    }

    static boolean holds(String marker, MarkerEnvironment environment) {
        if (marker == null)
            return true;
        try {
            return Marker.evaluate(marker, environment);
        } catch (IllegalArgumentException e) {
            LOG.debug("Following requirement with unreadable marker '{}': {}", marker, e.getMessage());
            return true;
        }
    }
}
