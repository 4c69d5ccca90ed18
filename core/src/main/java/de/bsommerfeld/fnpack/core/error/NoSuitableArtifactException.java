package de.bsommerfeld.fnpack.core.error;

import java.util.List;

/**
 * Every acquisition strategy passed on a dependency. The archive would be
 * missing code, so the run aborts.
 */
public class NoSuitableArtifactException extends PackagingException {

    private final String name;
    private final String version;
    private final List<String> reasons;

    public NoSuitableArtifactException(String name, String version, List<String> reasons, Throwable cause) {
        super(buildMessage(name, version, reasons), cause);
        this.name = name;
        this.version = version;
        this.reasons = List.copyOf(reasons);
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    /** One entry per attempted strategy, in attempt order. */
    public List<String> reasons() {
        return reasons;
    }

    private static String buildMessage(String name, String version, List<String> reasons) {
        StringBuilder sb = new StringBuilder("Unable to find suitable source for ")
                .append(name).append("==").append(version);
        for (String reason : reasons) {
            sb.append("\n  - ").append(reason);
        }
        return sb.toString();
    }
}
