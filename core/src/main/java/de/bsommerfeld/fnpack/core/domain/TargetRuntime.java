package de.bsommerfeld.fnpack.core.domain;

import java.util.Locale;

/**
 * Function runtimes an archive can be built for.
 *
 * <p>
 * Each runtime carries the platform tag its portable binary wheels end with.
 * The tag doubles as the filename suffix of cached wheels, see
 * {@link #wheelFileName(String, String)}.
 */
public enum TargetRuntime {

    PYTHON27("python2.7", "cp27-cp27mu-manylinux1_x86_64.whl"),
    PYTHON36("python3.6", "cp36-cp36m-manylinux1_x86_64.whl");

    private final String id;
    private final String platformTag;

    TargetRuntime(String id, String platformTag) {
        this.id = id;
        this.platformTag = platformTag;
    }

    /** Identifier as used by the function platform, e.g. {@code python3.6}. */
    public String id() {
        return id;
    }

    public String platformTag() {
        return platformTag;
    }

    /** Language version the runtime runs, e.g. {@code 3.6}. */
    public String pythonVersion() {
        return id.substring(id.indexOf("python") + "python".length());
    }

    /**
     * Resolves a runtime from its identifier ({@code python3.6}) or enum
     * name ({@code PYTHON36}), ignoring case.
     *
     * @throws IllegalArgumentException for unknown runtimes
     */
    public static TargetRuntime of(String value) {
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (TargetRuntime runtime : values()) {
            if (runtime.id.equals(normalized) || runtime.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return runtime;
            }
        }
        throw new IllegalArgumentException("Unknown target runtime: " + value);
    }

    /**
     * Conventional cache filename of a wheel: {@code {name}-{version}-{platformTag}}.
     */
    public static String wheelFileName(String name, String version, String platformTag) {
        return name + "-" + version + "-" + platformTag;
    }

    public String wheelFileName(String name, String version) {
        return wheelFileName(name, version, platformTag);
    }
}
