package de.bsommerfeld.fnpack.packager.acquire;

import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import de.bsommerfeld.fnpack.core.error.RegistryException;
import de.bsommerfeld.fnpack.packager.extract.ArchiveExtractor;
import de.bsommerfeld.fnpack.registry.RegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Downloads a portable wheel from the registry into the private cache and
 * installs it.
 *
 * <p>
 * The wheel is stored under the conventional cache name, so a later run
 * picks it up through {@link CachedWheelStrategy}. Registry failures
 * (transport errors, non-2xx answers) are not swallowed: they abort the run.
 */
public class WheelDownloadStrategy implements AcquisitionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(WheelDownloadStrategy.class);

    private final RegistryClient registry;
    private final ArchiveExtractor extractor;
    private final Path privateCache;
    private final String platformTag;

    public WheelDownloadStrategy(RegistryClient registry, ArchiveExtractor extractor, Path privateCache,
            TargetRuntime runtime, String platformTag) {
        this.registry = registry;
        this.extractor = extractor;
        this.privateCache = privateCache;
        this.platformTag = platformTag != null ? platformTag : runtime.platformTag();
    }

    @Override
    public String name() {
        return "registry-wheel";
    }

    @Override
    public AcquisitionResult attempt(Path stagingTree, Distribution dependency)
            throws RegistryException, IOException {
        Optional<String> url = registry.findArtifactUrl(dependency.key(), dependency.version(), platformTag);
        if (url.isEmpty())
            return AcquisitionResult.notApplicable("registry has no " + platformTag + " wheel");

        Files.createDirectories(privateCache);
        Path target = privateCache.resolve(
                TargetRuntime.wheelFileName(dependency.key(), dependency.version(), platformTag));

        LOG.info("Downloading {} from {}", target.getFileName(), url.get());
        registry.download(url.get(), target);

        extractor.extractZip(target, stagingTree, n -> true);
        return AcquisitionResult.installed(url.get());
    }
}
