package de.bsommerfeld.fnpack.index;

import com.google.inject.Singleton;
import de.bsommerfeld.fnpack.core.domain.DependencySet;
import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.error.UnresolvedDependencyException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a root distribution into its transitive dependency closure.
 *
 * <h3>Cycles</h3>
 * Every distribution is added to the result <em>before</em> its own
 * requirements are walked. A requirement that points back at something
 * already in the set is a no-op, so cycles terminate and each key appears
 * once.
 *
 * <p>
 * The walk is pure: it only queries the index. A missing requirement aborts
 * resolution before the packaging run touches the filesystem.
 */
@Singleton
public class DependencyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyResolver.class);

    private final PackageIndex index;

    @Inject
    public DependencyResolver(PackageIndex index) {
        this.index = index;
    }

    /**
     * Resolves the closure of {@code rootName}, root included.
     *
     * @throws UnresolvedDependencyException if the root or any requirement is
     *                                       not installed
     */
    public DependencySet resolve(String rootName) throws UnresolvedDependencyException {
        Distribution root = index.find(rootName)
                .orElseThrow(() -> new UnresolvedDependencyException(rootName, null));

        DependencySet result = new DependencySet(rootName);
        walk(root, result);
        LOG.info("Resolved {} distributions for {}", result.size(), root);
        return result;
    }

    private void walk(Distribution distribution, DependencySet visited) throws UnresolvedDependencyException {
        if (!visited.add(distribution))
            return;

        for (String requirement : distribution.requirements()) {
            if (visited.contains(requirement))
                continue;

            Distribution dependency = index.find(requirement)
                    .orElseThrow(() -> new UnresolvedDependencyException(requirement, distribution.key()));
            LOG.debug("{} requires {}", distribution, dependency);
            walk(dependency, visited);
        }
    }
}
