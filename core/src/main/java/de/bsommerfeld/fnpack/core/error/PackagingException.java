package de.bsommerfeld.fnpack.core.error;

/**
 * Thrown when a packaging run fails unrecoverably. The run aborts and no
 * archive is written to the destination.
 */
public class PackagingException extends Exception {

    public PackagingException(String message) {
        super(message);
    }

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
