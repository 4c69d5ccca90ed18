package de.bsommerfeld.fnpack.core.error;

/**
 * The install location is unknown, missing, or a file that is not a legacy
 * {@code .egg} bundle.
 */
public class UnsupportedLocalLayoutException extends LocalLayoutException {

    public UnsupportedLocalLayoutException(String message) {
        super(message);
    }

    public UnsupportedLocalLayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
