package de.bsommerfeld.fnpack.packager.local;

import de.bsommerfeld.fnpack.core.domain.Distribution;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates the ownership manifest of one on-disk installation layout.
 * {@link OwnershipLayouts} holds the detectors in probing order.
 */
@FunctionalInterface
interface OwnershipLayout {

    Optional<OwnershipManifest> detect(Distribution distribution, Path location) throws IOException;
}
