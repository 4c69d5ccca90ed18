package de.bsommerfeld.fnpack.core.error;

/**
 * Transport or HTTP status failure while talking to the package registry.
 * Never retried.
 */
public class RegistryException extends PackagingException {

    private final int statusCode;

    public RegistryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed response, or {@code -1} for transport errors. */
    public int statusCode() {
        return statusCode;
    }
}
