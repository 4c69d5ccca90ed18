package de.bsommerfeld.fnpack.packager.build;

import de.bsommerfeld.fnpack.core.error.PackagingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonBytecodeCompilerTest {

    @TempDir
    Path tmp;

    @Test
    void compile_shouldSkipInterpreterForEmptyInput() throws Exception {
        CompilationReport report = new PythonBytecodeCompiler("no-such-python-binary").compile(List.of());

        assertTrue(report.compiled().isEmpty());
        assertTrue(report.failures().isEmpty());
    }

    @Test
    void compile_shouldFailWhenInterpreterCannotStart() {
        PythonBytecodeCompiler compiler = new PythonBytecodeCompiler(tmp.resolve("no-such-python").toString());

        assertThrows(PackagingException.class, () -> compiler.compile(List.of(tmp.resolve("a.py"))));
    }

    @Test
    void parseLine_shouldSortOutcomes() {
        List<Path> compiled = new ArrayList<>();
        List<CompilationReport.Failure> failures = new ArrayList<>();

        PythonBytecodeCompiler.parseLine("OK /stage/pkg/a.py", compiled, failures);
        PythonBytecodeCompiler.parseLine("FAIL /stage/pkg/b.py\tinvalid syntax (b.py, line 1)", compiled, failures);
        PythonBytecodeCompiler.parseLine("DeprecationWarning: something", compiled, failures);

        assertEquals(List.of(Path.of("/stage/pkg/a.py")), compiled);
        assertEquals(1, failures.size());
        assertEquals(Path.of("/stage/pkg/b.py"), failures.get(0).source());
        assertEquals("invalid syntax (b.py, line 1)", failures.get(0).message());
    }

    @Test
    void script_shouldWriteLegacyCompiledSibling() {
        assertTrue(PythonBytecodeCompiler.COMPILE_SCRIPT.contains("cfile=path + 'c'"));
    }

    // -- real interpreter --

    private static boolean python3Available() {
        try {
            Process process = new ProcessBuilder("python3", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Test
    void compile_shouldKeepSourceOfFileWithSyntaxError() throws Exception {
        assumeTrue(python3Available(), "python3 is not on the PATH");
        Path pkg = Files.createDirectories(tmp.resolve("pkg"));
        Path good = Files.writeString(pkg.resolve("good.py"), "def handler(event, context):\n    return 42\n");
        Path bad = Files.writeString(pkg.resolve("bad.py"), "def (:\n");

        CompilationReport report = new PythonBytecodeCompiler("python3").compile(List.of(good, bad));
        int pruned = new SourcePruner().prune(tmp);

        assertEquals(List.of(good), report.compiled());
        assertEquals(1, report.failures().size());
        assertEquals(bad, report.failures().get(0).source());
        assertEquals(1, pruned);
        assertTrue(Files.exists(pkg.resolve("good.pyc")));
        assertFalse(Files.exists(good));
        assertTrue(Files.exists(bad));
        assertFalse(Files.exists(pkg.resolve("bad.pyc")));
    }
}
