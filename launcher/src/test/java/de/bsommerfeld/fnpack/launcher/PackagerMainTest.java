package de.bsommerfeld.fnpack.launcher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the command line against a fixture installation.
 */
class PackagerMainTest {

    @TempDir
    Path tmp;

    private PackagerFixture fixture;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new PackagerFixture(tmp);
    }

    private int run(String... args) {
        return PackagerMain.run(args);
    }

    private static List<String> entries(Path archive) throws Exception {
        List<String> names = new ArrayList<>();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> e = zip.entries();
            while (e.hasMoreElements())
                names.add(e.nextElement().getName());
        }
        return names;
    }

    // -- success --

    @Test
    void run_shouldPackageRootAndCachedDependency() throws Exception {
        Path destination = tmp.resolve("dist/function.zip");

        int exit = run("myfunc", destination.toString(), "--entry", "from myfunc import handler",
                "--config", fixture.configFile.toString());

        assertEquals(PackagerMain.EXIT_OK, exit);
        assertEquals(List.of("index.py", "myfunc/__init__.pyc", "six.pyc"), entries(destination));
    }

    // -- failures --

    @Test
    void run_shouldExitWithUsageForIncompleteCommandLine() {
        assertEquals(PackagerMain.EXIT_USAGE, run("myfunc"));
        assertEquals(PackagerMain.EXIT_USAGE, run("myfunc", "f.zip", "--entry", "x", "--runtime", "ruby2.5"));
    }

    @Test
    void run_shouldFailForRemoteDestination() {
        int exit = run("myfunc", "s3://bucket/function.zip", "--entry", "x",
                "--config", fixture.configFile.toString());

        assertEquals(PackagerMain.EXIT_FAILURE, exit);
    }

    @Test
    void run_shouldFailForUnknownPackage() {
        Path destination = tmp.resolve("function.zip");

        int exit = run("unknown", destination.toString(), "--entry", "x",
                "--config", fixture.configFile.toString());

        assertEquals(PackagerMain.EXIT_FAILURE, exit);
        assertFalse(Files.exists(destination));
    }

    @Test
    void run_shouldFailForMissingEntryFile() {
        int exit = run("myfunc", tmp.resolve("f.zip").toString(), "--entry-file", tmp.resolve("nope.py").toString(),
                "--config", fixture.configFile.toString());

        assertEquals(PackagerMain.EXIT_FAILURE, exit);
    }
}
