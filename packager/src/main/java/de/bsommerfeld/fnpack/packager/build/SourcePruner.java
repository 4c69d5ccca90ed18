package de.bsommerfeld.fnpack.packager.build;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.inject.Singleton;
import de.bsommerfeld.fnpack.core.domain.PythonLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Removes what must not ship: {@code __pycache__} directories and every
 * source whose compiled sibling exists. Sources that failed to compile stay.
 */
@Singleton
public class SourcePruner {

    private static final Logger LOG = LoggerFactory.getLogger(SourcePruner.class);

    /**
     * @return number of removed sources
     */
    public int prune(Path tree) throws IOException {
        List<Path> caches;
        try (Stream<Path> walk = Files.walk(tree)) {
            caches = walk.filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().equals(PythonLayout.CACHE_DIRECTORY))
                    .toList();
        }
        for (Path cache : caches) {
            if (Files.exists(cache))
                MoreFiles.deleteRecursively(cache, RecursiveDeleteOption.ALLOW_INSECURE);
        }

        List<Path> sources;
        try (Stream<Path> walk = Files.walk(tree)) {
            sources = walk.filter(Files::isRegularFile)
                    .filter(p -> PythonLayout.isSource(p.getFileName().toString()))
                    .filter(p -> Files.exists(p.resolveSibling(
                            PythonLayout.compiledSibling(p.getFileName().toString()))))
                    .toList();
        }
        for (Path source : sources) {
            Files.delete(source);
        }

        LOG.debug("Pruned {} cache directories and {} sources", caches.size(), sources.size());
        return sources.size();
    }
}
