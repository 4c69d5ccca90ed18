package de.bsommerfeld.fnpack.packager.acquire;

import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.error.NoSuitableArtifactException;
import de.bsommerfeld.fnpack.core.error.PackagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of {@link AcquisitionStrategy strategies}; the first one that
 * installs a dependency wins.
 *
 * <h3>Standard order</h3>
 * <ol>
 * <li>bundled precompiled build, exact version</li>
 * <li>cached portable wheel</li>
 * <li>portable wheel from the registry</li>
 * <li>bundled precompiled build, any version</li>
 * <li>the local installation</li>
 * </ol>
 * When every strategy passes, the run fails with
 * {@link NoSuitableArtifactException} carrying each strategy's reason.
 */
public class AcquisitionChain {

    private static final Logger LOG = LoggerFactory.getLogger(AcquisitionChain.class);

    private final List<AcquisitionStrategy> strategies;

    public AcquisitionChain(List<AcquisitionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public List<AcquisitionStrategy> strategies() {
        return strategies;
    }

    /**
     * Installs {@code dependency} into {@code stagingTree}.
     *
     * @return the strategy that installed it
     * @throws NoSuitableArtifactException if no strategy applied
     */
    public AcquisitionStrategy acquire(Path stagingTree, Distribution dependency)
            throws PackagingException, IOException {
        List<String> reasons = new ArrayList<>();
        Throwable lastCause = null;

        for (AcquisitionStrategy strategy : strategies) {
            AcquisitionResult result = strategy.attempt(stagingTree, dependency);
            if (result.installed()) {
                LOG.info("Installed {} via {} ({})", dependency, strategy.name(), result.detail());
                return strategy;
            }

            LOG.debug("{} not applicable for {}: {}", strategy.name(), dependency, result.detail());
            reasons.add(strategy.name() + ": " + result.detail());
            if (result.cause() != null)
                lastCause = result.cause();
        }

        throw new NoSuitableArtifactException(dependency.key(), dependency.version(), reasons, lastCause);
    }
}
