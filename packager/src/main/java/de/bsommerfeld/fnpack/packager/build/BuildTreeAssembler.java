package de.bsommerfeld.fnpack.packager.build;

import com.google.inject.Singleton;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.domain.PythonLayout;
import de.bsommerfeld.fnpack.core.error.PackagingException;
import de.bsommerfeld.fnpack.packager.acquire.AcquisitionChain;
import de.bsommerfeld.fnpack.packager.acquire.AcquisitionStrategy;
import de.bsommerfeld.fnpack.packager.local.LocalUnpacker;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Fills a staging tree with everything the function archive contains.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>every dependency is acquired through the {@link AcquisitionChain}</li>
 * <li>the root project is always taken from its local installation</li>
 * <li>all sources are compiled</li>
 * <li>caches and compiled sources are pruned</li>
 * <li>the entry shim is written to {@code index.py}</li>
 * </ol>
 */
@Singleton
public class BuildTreeAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(BuildTreeAssembler.class);

    private final AcquisitionChain chain;
    private final LocalUnpacker unpacker;
    private final BytecodeCompiler compiler;
    private final SourcePruner pruner;

    @Inject
    public BuildTreeAssembler(AcquisitionChain chain, LocalUnpacker unpacker, BytecodeCompiler compiler,
            SourcePruner pruner) {
        this.chain = chain;
        this.unpacker = unpacker;
        this.compiler = compiler;
        this.pruner = pruner;
    }

    /**
     * @param dependencies the root's transitive dependencies, root excluded
     * @param entry        handler shim source, written verbatim
     */
    public AssemblyReport populate(Path stagingTree, Distribution root, Collection<Distribution> dependencies,
            String entry) throws PackagingException, IOException {
        Map<String, String> sources = new LinkedHashMap<>();

        // ===== Dependencies =====
        for (Distribution dependency : dependencies) {
            AcquisitionStrategy strategy = chain.acquire(stagingTree, dependency);
            sources.put(dependency.key(), strategy.name());
        }

        // ===== Root project =====
        LOG.info("Unpacking {} from {}", root, root.location());
        unpacker.unpackLocal(stagingTree, root);
        sources.put(root.key(), "local-install");

        // ===== Compile and prune =====
        CompilationReport compilation = compiler.compile(collectSources(stagingTree));
        int pruned = pruner.prune(stagingTree);

        // ===== Shim =====
        Files.writeString(stagingTree.resolve(PythonLayout.SHIM_FILE), entry, StandardCharsets.UTF_8);

        return new AssemblyReport(sources, compilation, pruned);
    }

    static List<Path> collectSources(Path tree) throws IOException {
        try (Stream<Path> walk = Files.walk(tree)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> PythonLayout.isSource(p.getFileName().toString()))
                    .filter(p -> !p.toString().contains(PythonLayout.CACHE_DIRECTORY))
                    .sorted()
                    .toList();
        }
    }
}
