package de.bsommerfeld.fnpack.core.error;

/**
 * A declared requirement names a distribution the installed-package index
 * does not know.
 */
public class UnresolvedDependencyException extends PackagingException {

    private final String requirement;
    private final String requiredBy;

    public UnresolvedDependencyException(String requirement, String requiredBy) {
        super(requiredBy == null
                ? "Distribution '" + requirement + "' is not installed"
                : "Distribution '" + requirement + "' required by '" + requiredBy + "' is not installed");
        this.requirement = requirement;
        this.requiredBy = requiredBy;
    }

    public String requirement() {
        return requirement;
    }

    /** Requiring distribution, or {@code null} when the root itself is missing. */
    public String requiredBy() {
        return requiredBy;
    }
}
