package de.bsommerfeld.fnpack.core.domain;

import java.nio.file.Path;

/**
 * A precompiled artifact known to a cache or store.
 *
 * @param name        canonical distribution key
 * @param version     version the artifact was built from
 * @param runtime     target-runtime identifier, e.g. {@code python3.6}
 * @param platformTag ABI and platform suffix the artifact was built for
 * @param path        archive file holding the artifact contents
 */
public record ArtifactRecord(String name, String version, String runtime, String platformTag, Path path) {
}
