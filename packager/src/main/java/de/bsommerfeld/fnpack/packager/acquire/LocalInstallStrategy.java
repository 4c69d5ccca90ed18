package de.bsommerfeld.fnpack.packager.acquire;

import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.error.LocalLayoutException;
import de.bsommerfeld.fnpack.packager.local.LocalUnpacker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Last resort: copy the files of the locally installed distribution.
 *
 * <p>
 * Layouts the {@link LocalUnpacker} cannot handle make this strategy
 * non-applicable; the layout failure is kept as the cause so the final
 * error report shows it.
 */
public class LocalInstallStrategy implements AcquisitionStrategy {

    private final LocalUnpacker unpacker;

    public LocalInstallStrategy(LocalUnpacker unpacker) {
        this.unpacker = unpacker;
    }

    @Override
    public String name() {
        return "local-install";
    }

    @Override
    public AcquisitionResult attempt(Path stagingTree, Distribution dependency) throws IOException {
        if (!dependency.hasLocation() || !Files.exists(dependency.location()))
            return AcquisitionResult.notApplicable("no local installation");

        try {
            unpacker.unpackLocal(stagingTree, dependency);
        } catch (LocalLayoutException e) {
            return AcquisitionResult.notApplicable(e.getMessage(), e);
        }
        return AcquisitionResult.installed(dependency.location().toString());
    }
}
