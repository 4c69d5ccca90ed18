package de.bsommerfeld.fnpack.core.domain;

/**
 * File naming conventions of the packaged tree.
 *
 * <p>
 * Compiled modules use the legacy sourceless layout: {@code mod.py} compiles
 * to {@code mod.pyc} next to it, which the runtime imports without the
 * source present. The per-interpreter {@code __pycache__} directories are
 * never shipped.
 */
public final class PythonLayout {

    public static final String SOURCE_SUFFIX = ".py";
    public static final String COMPILED_SUFFIX = ".pyc";
    public static final String CACHE_DIRECTORY = "__pycache__";

    /** Shim written at the archive root; the function handler lives here. */
    public static final String SHIM_FILE = "index.py";

    private PythonLayout() {
    }

    public static boolean isSource(String fileName) {
        return fileName.endsWith(SOURCE_SUFFIX);
    }

    /** {@code pkg/mod.py} becomes {@code pkg/mod.pyc}. */
    public static String compiledSibling(String sourceName) {
        return sourceName + "c";
    }
}
