package de.bsommerfeld.fnpack.packager;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.inject.Singleton;
import de.bsommerfeld.fnpack.core.domain.DependencySet;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.error.PackagingException;
import de.bsommerfeld.fnpack.core.error.UnresolvedDependencyException;
import de.bsommerfeld.fnpack.index.DependencyResolver;
import de.bsommerfeld.fnpack.packager.archive.ArchiveWriter;
import de.bsommerfeld.fnpack.packager.build.AssemblyReport;
import de.bsommerfeld.fnpack.packager.build.BuildTreeAssembler;
import de.bsommerfeld.fnpack.packager.output.OutputSink;
import de.bsommerfeld.fnpack.packager.output.OutputSinks;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point of a packaging run: installed project in, function archive out.
 *
 * <p>
 * The run works in a private staging directory and a temporary archive,
 * both removed when the run ends, successfully or not. The destination is
 * only written once the archive is complete.
 */
@Singleton
public class FunctionPackager {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionPackager.class);

    private final DependencyResolver resolver;
    private final BuildTreeAssembler assembler;
    private final ArchiveWriter writer;

    @Inject
    public FunctionPackager(DependencyResolver resolver, BuildTreeAssembler assembler, ArchiveWriter writer) {
        this.resolver = resolver;
        this.assembler = assembler;
        this.writer = writer;
    }

    /**
     * Packages {@code rootName} and its dependencies with {@code entry} as
     * handler shim and delivers the archive to {@code destination}.
     *
     * @throws UnresolvedDependencyException if the root or a requirement is
     *                                       not installed
     * @throws PackagingException            for any other fatal condition
     */
    public PackagingResult pack(String rootName, String entry, String destination)
            throws PackagingException, IOException {
        OutputSink sink = OutputSinks.forDestination(destination);

        DependencySet dependencies = resolver.resolve(rootName);
        Distribution root = dependencies.root()
                .orElseThrow(() -> new UnresolvedDependencyException(rootName, null));
        LOG.info("Packaging {} with {} dependencies", root, dependencies.size() - 1);

        Path stagingTree = Files.createTempDirectory("fnpack-staging-");
        Path archive = null;
        try {
            AssemblyReport assembly = assembler.populate(stagingTree, root, dependencies.withoutRoot(), entry);

            archive = Files.createTempFile("fnpack-", ".zip");
            int archivedFiles = writer.write(stagingTree, archive);

            sink.write(archive);
            return new PackagingResult(destination, assembly, archivedFiles);
        } finally {
            cleanUp(stagingTree, archive);
        }
    }

    private static void cleanUp(Path stagingTree, Path archive) {
        try {
            if (archive != null)
                Files.deleteIfExists(archive);
            MoreFiles.deleteRecursively(stagingTree, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            LOG.warn("Failed to clean up staging files in {}", stagingTree, e);
        }
    }
}
