package de.bsommerfeld.fnpack.packager.acquire;

import de.bsommerfeld.fnpack.core.domain.ArtifactRecord;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import de.bsommerfeld.fnpack.packager.cache.WheelCache;
import de.bsommerfeld.fnpack.packager.extract.ArchiveExtractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Installs a portable wheel that is already on disk. Never touches the network.
 */
public class CachedWheelStrategy implements AcquisitionStrategy {

    private final WheelCache cache;
    private final ArchiveExtractor extractor;
    private final TargetRuntime runtime;
    private final String platformTag;

    public CachedWheelStrategy(WheelCache cache, ArchiveExtractor extractor, TargetRuntime runtime,
            String platformTag) {
        this.cache = cache;
        this.extractor = extractor;
        this.runtime = runtime;
        this.platformTag = platformTag;
    }

    @Override
    public String name() {
        return "cached-wheel";
    }

    @Override
    public AcquisitionResult attempt(Path stagingTree, Distribution dependency) throws IOException {
        Optional<ArtifactRecord> wheel = cache.find(dependency, runtime, platformTag);
        if (wheel.isEmpty())
            return AcquisitionResult.notApplicable("no cached " + platformTag + " wheel");

        extractor.extractZip(wheel.get().path(), stagingTree, n -> true);
        return AcquisitionResult.installed(wheel.get().path().toString());
    }
}
