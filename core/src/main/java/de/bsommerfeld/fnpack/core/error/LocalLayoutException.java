package de.bsommerfeld.fnpack.core.error;

/**
 * The locally installed layout of a distribution cannot be unpacked.
 */
public abstract class LocalLayoutException extends PackagingException {

    protected LocalLayoutException(String message) {
        super(message);
    }

    protected LocalLayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
