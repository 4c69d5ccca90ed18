package de.bsommerfeld.fnpack.packager.output;

import de.bsommerfeld.fnpack.core.error.OutputNotSupportedException;

import java.net.URI;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Picks the {@link OutputSink} for a destination string.
 */
public final class OutputSinks {

    static final String FILE_SCHEME = "file://";

    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://");

    private OutputSinks() {
    }

    /**
     * Plain paths and {@code file://} URIs are written locally. The local
     * target is resolved here, so a malformed destination fails before any
     * packaging work is done.
     *
     * @throws OutputNotSupportedException for any other scheme, e.g.
     *                                     {@code s3://}, and for destinations
     *                                     that do not denote a local path
     */
    public static OutputSink forDestination(String destination) throws OutputNotSupportedException {
        if (!destination.startsWith(FILE_SCHEME) && SCHEME.matcher(destination).find())
            throw new OutputNotSupportedException(destination);
        return new LocalFileSink(toPath(destination));
    }

    /**
     * {@code file://out.zip} puts {@code out.zip} in the URI authority and
     * is rejected; local URIs need an empty authority ({@code file:///}).
     */
    static Path toPath(String destination) throws OutputNotSupportedException {
        try {
            if (destination.startsWith(FILE_SCHEME))
                return Path.of(URI.create(destination));
            return Path.of(destination);
        } catch (IllegalArgumentException e) {
            throw new OutputNotSupportedException(destination, e.getMessage());
        }
    }
}
