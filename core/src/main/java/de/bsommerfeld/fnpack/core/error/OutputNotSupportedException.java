package de.bsommerfeld.fnpack.core.error;

/**
 * The destination uses a scheme no output sink implements yet (e.g.
 * {@code s3://}), or does not denote a writable local path.
 */
public class OutputNotSupportedException extends PackagingException {

    public OutputNotSupportedException(String destination) {
        super("Output destination not implemented: " + destination);
    }

    public OutputNotSupportedException(String destination, String reason) {
        super("Invalid output destination " + destination + ": " + reason);
    }
}
