package de.bsommerfeld.fnpack.packager.acquire;

import de.bsommerfeld.fnpack.core.domain.Distribution;
import de.bsommerfeld.fnpack.core.error.PackagingException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One way of getting a dependency's files into the staging tree.
 *
 * <p>
 * A strategy that cannot serve a dependency reports
 * {@link AcquisitionResult#notApplicable} so the chain moves on. Throwing
 * aborts the whole packaging run and is reserved for failures no later
 * strategy could recover from.
 */
public interface AcquisitionStrategy {

    /** Short label used in logs and failure reports. */
    String name();

    AcquisitionResult attempt(Path stagingTree, Distribution dependency) throws PackagingException, IOException;
}
