package de.bsommerfeld.fnpack.packager.acquire;

/**
 * Outcome of one acquisition attempt.
 *
 * @param installed {@code true} if the dependency now sits in the staging tree
 * @param detail    what was installed, or why the strategy did not apply
 * @param cause     failure behind a non-applicable result, may be {@code null}
 */
public record AcquisitionResult(boolean installed, String detail, Throwable cause) {

    public static AcquisitionResult installed(String detail) {
        return new AcquisitionResult(true, detail, null);
    }

    public static AcquisitionResult notApplicable(String reason) {
        return new AcquisitionResult(false, reason, null);
    }

    public static AcquisitionResult notApplicable(String reason, Throwable cause) {
        return new AcquisitionResult(false, reason, cause);
    }
}
