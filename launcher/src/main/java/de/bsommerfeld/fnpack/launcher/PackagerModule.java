package de.bsommerfeld.fnpack.launcher;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.fnpack.core.config.PackagerConfig;
import de.bsommerfeld.fnpack.core.domain.IgnorePatternSet;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import de.bsommerfeld.fnpack.index.InterpreterPaths;
import de.bsommerfeld.fnpack.index.MarkerEnvironment;
import de.bsommerfeld.fnpack.index.PackageIndex;
import de.bsommerfeld.fnpack.index.SitePackagesIndex;
import de.bsommerfeld.fnpack.packager.acquire.AcquisitionChain;
import de.bsommerfeld.fnpack.packager.acquire.BundledArtifactStrategy;
import de.bsommerfeld.fnpack.packager.acquire.CachedWheelStrategy;
import de.bsommerfeld.fnpack.packager.acquire.LocalInstallStrategy;
import de.bsommerfeld.fnpack.packager.acquire.WheelDownloadStrategy;
import de.bsommerfeld.fnpack.packager.archive.ArchiveWriter;
import de.bsommerfeld.fnpack.packager.build.BytecodeCompiler;
import de.bsommerfeld.fnpack.packager.build.PythonBytecodeCompiler;
import de.bsommerfeld.fnpack.packager.cache.BundledArtifactStore;
import de.bsommerfeld.fnpack.packager.cache.WheelCache;
import de.bsommerfeld.fnpack.packager.extract.ArchiveExtractor;
import de.bsommerfeld.fnpack.packager.local.LocalUnpacker;
import de.bsommerfeld.fnpack.registry.RegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Guice module wiring a packaging run from one {@link PackagerConfig}.
 *
 * <p>
 * Components with an {@code @Inject} constructor (resolver, registry client,
 * unpacker, assembler, facade) bind just-in-time. Everything that needs a
 * config value is provided here.
 */
public class PackagerModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(PackagerModule.class);

    private final PackagerConfig config;

    public PackagerModule(PackagerConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(PackagerConfig.class).toInstance(config);
        LOG.info("Target runtime: {} ({})", config.runtime().id(), config.effectivePlatformTag());
    }

    @Provides
    @Singleton
    TargetRuntime targetRuntime() {
        return config.runtime();
    }

    @Provides
    @Singleton
    IgnorePatternSet ignorePatterns() {
        return config.ignorePatternSet();
    }

    @Provides
    @Singleton
    ArchiveExtractor archiveExtractor(IgnorePatternSet ignore) {
        return new ArchiveExtractor(ignore);
    }

    @Provides
    @Singleton
    PackageIndex packageIndex(TargetRuntime runtime) {
        try {
            List<Path> searchPath = config.getSitePackages().isEmpty()
                    ? InterpreterPaths.query(config.getPythonExecutable())
                    : config.getSitePackages().stream().map(Path::of).toList();
            SitePackagesIndex index = SitePackagesIndex.scan(searchPath, MarkerEnvironment.forRuntime(runtime));
            LOG.info("Indexed {} installed distributions", index.distributions().size());
            return index;
        } catch (IOException e) {
            throw new RuntimeException("Failed to index installed distributions", e);
        }
    }

    @Provides
    @Singleton
    BundledArtifactStore bundledArtifactStore() {
        String manifest = config.getBundledStoreManifest();
        if (manifest == null || manifest.isBlank())
            return BundledArtifactStore.empty();
        try {
            return BundledArtifactStore.load(Path.of(manifest));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load bundled store manifest " + manifest, e);
        }
    }

    @Provides
    @Singleton
    WheelCache wheelCache() {
        return new WheelCache(List.of(config.wheelCachePath(), config.privateCachePath()));
    }

    /**
     * The standard strategy order: exact bundled build, cached wheel,
     * registry wheel, bundled build of any version, local installation.
     */
    @Provides
    @Singleton
    AcquisitionChain acquisitionChain(BundledArtifactStore store, WheelCache cache, RegistryClient registry,
            ArchiveExtractor extractor, LocalUnpacker unpacker, TargetRuntime runtime) {
        String tag = config.effectivePlatformTag();
        return new AcquisitionChain(List.of(
                new BundledArtifactStrategy(store, extractor, runtime, true),
                new CachedWheelStrategy(cache, extractor, runtime, tag),
                new WheelDownloadStrategy(registry, extractor, config.privateCachePath(), runtime, tag),
                new BundledArtifactStrategy(store, extractor, runtime, false),
                new LocalInstallStrategy(unpacker)));
    }

    @Provides
    @Singleton
    BytecodeCompiler bytecodeCompiler() {
        return new PythonBytecodeCompiler(config.getPythonExecutable());
    }

    @Provides
    @Singleton
    ArchiveWriter archiveWriter() {
        return new ArchiveWriter(config.isReproducibleArchives());
    }
}
