package de.bsommerfeld.fnpack.packager.output;

import de.bsommerfeld.fnpack.core.error.PackagingException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Delivers a finished archive to the destination the sink was created for.
 */
public interface OutputSink {

    void write(Path archive) throws PackagingException, IOException;
}
