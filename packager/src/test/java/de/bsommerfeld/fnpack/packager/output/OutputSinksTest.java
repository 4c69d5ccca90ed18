package de.bsommerfeld.fnpack.packager.output;

import de.bsommerfeld.fnpack.core.error.OutputNotSupportedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OutputSinksTest {

    @TempDir
    Path tmp;

    private static Path target(String destination) throws Exception {
        return assertInstanceOf(LocalFileSink.class, OutputSinks.forDestination(destination)).target();
    }

    @Test
    void forDestination_shouldWriteLocalPathsAndFileUris() throws Exception {
        assertEquals(Path.of("build/function.zip"), target("build/function.zip"));
        assertEquals(tmp.resolve("f.zip"), target(tmp.resolve("f.zip").toUri().toString()));
    }

    @Test
    void forDestination_shouldRejectFileUriWithAuthority() {
        OutputNotSupportedException e = assertThrows(OutputNotSupportedException.class,
                () -> OutputSinks.forDestination("file://out.zip"));
        assertTrue(e.getMessage().contains("file://out.zip"));
    }

    @Test
    void forDestination_shouldRejectRemoteSchemes() {
        OutputNotSupportedException e = assertThrows(OutputNotSupportedException.class,
                () -> OutputSinks.forDestination("s3://bucket/function.zip"));
        assertTrue(e.getMessage().contains("s3://bucket/function.zip"));
    }

    @Test
    void write_shouldCopyReplacingExistingFile() throws Exception {
        Path archive = Files.writeString(tmp.resolve("archive.zip"), "new");
        Path target = tmp.resolve("dist/nested/function.zip");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "old");

        new LocalFileSink(target).write(archive);

        assertEquals("new", Files.readString(target));
    }

    @Test
    void write_shouldResolveFileUris() throws Exception {
        Path archive = Files.writeString(tmp.resolve("archive.zip"), "zip");
        Path target = tmp.resolve("out/function.zip");

        OutputSinks.forDestination(target.toUri().toString()).write(archive);

        assertEquals("zip", Files.readString(target));
    }
}
