package de.bsommerfeld.fnpack.packager.acquire;

import de.bsommerfeld.fnpack.core.domain.ArtifactRecord;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import de.bsommerfeld.fnpack.packager.cache.BundledArtifactStore;
import de.bsommerfeld.fnpack.packager.extract.ArchiveExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Installs a precompiled build shipped in the {@link BundledArtifactStore}.
 *
 * <p>
 * Runs twice in the standard chain: first demanding the exact version,
 * later accepting whatever version is bundled. A version mismatch in the
 * second pass is logged as a warning.
 */
public class BundledArtifactStrategy implements AcquisitionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(BundledArtifactStrategy.class);

    private final BundledArtifactStore store;
    private final ArchiveExtractor extractor;
    private final TargetRuntime runtime;
    private final boolean exactVersion;

    public BundledArtifactStrategy(BundledArtifactStore store, ArchiveExtractor extractor, TargetRuntime runtime,
            boolean exactVersion) {
        this.store = store;
        this.extractor = extractor;
        this.runtime = runtime;
        this.exactVersion = exactVersion;
    }

    @Override
    public String name() {
        return exactVersion ? "bundled" : "bundled-any-version";
    }

    @Override
    public AcquisitionResult attempt(Path stagingTree, Distribution dependency) throws IOException {
        Optional<ArtifactRecord> found = store.lookup(dependency.key(), dependency.version(), runtime, exactVersion);
        if (found.isEmpty())
            return AcquisitionResult.notApplicable("no bundled build for " + runtime.id());

        ArtifactRecord artifact = found.get();
        if (!Files.isRegularFile(artifact.path()))
            return AcquisitionResult.notApplicable("bundled archive missing: " + artifact.path());

        if (!artifact.version().equals(dependency.version())) {
            LOG.warn("Using bundled {} {} although {} is installed", dependency.key(), artifact.version(),
                    dependency.version());
        }

        extractor.extractTarGz(artifact.path(), stagingTree);
        return AcquisitionResult.installed(artifact.path().getFileName().toString());
    }
}
