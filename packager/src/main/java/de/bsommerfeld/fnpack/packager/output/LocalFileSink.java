package de.bsommerfeld.fnpack.packager.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies the archive to a local path, replacing an existing file.
 */
public class LocalFileSink implements OutputSink {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFileSink.class);

    private final Path target;

    public LocalFileSink(Path target) {
        this.target = target;
    }

    @Override
    public void write(Path archive) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);

        Files.copy(archive, target, StandardCopyOption.REPLACE_EXISTING);
        LOG.info("Archive written to {}", target);
    }

    Path target() {
        return target;
    }
}
