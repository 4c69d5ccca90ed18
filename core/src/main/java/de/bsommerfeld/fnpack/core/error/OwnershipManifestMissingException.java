package de.bsommerfeld.fnpack.core.error;

/**
 * No {@code top_level.txt} (or equivalent) tells which top-level modules a
 * locally installed distribution owns.
 */
public class OwnershipManifestMissingException extends LocalLayoutException {

    public OwnershipManifestMissingException(String message) {
        super(message);
    }
}
