package de.bsommerfeld.fnpack.packager.build;

import de.bsommerfeld.fnpack.core.error.PackagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles sources with the configured Python interpreter.
 *
 * <p>
 * The interpreter is started once per run. It reads the source list from a
 * temporary file and compiles each entry with {@code py_compile}, writing
 * {@code <source>c}. Each file is reported on its own output line, so a
 * syntax error in one module does not stop the others.
 */
public class PythonBytecodeCompiler implements BytecodeCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(PythonBytecodeCompiler.class);

    static final String OK_PREFIX = "OK ";
    static final String FAIL_PREFIX = "FAIL ";

    /** Runs on 2.7 and 3.x alike. */
    static final String COMPILE_SCRIPT = String.join("\n",
            "import io, py_compile, sys",
            "with io.open(sys.argv[1], encoding='utf-8') as listing:",
            "    for line in listing:",
            "        path = line.rstrip('\\n')",
            "        if not path:",
            "            continue",
            "        try:",
            "            py_compile.compile(path, cfile=path + 'c', doraise=True)",
            "            print('" + OK_PREFIX + "' + path)",
            "        except Exception as e:",
            "            print('" + FAIL_PREFIX + "' + path + '\\t' + ' '.join(str(e).split()))",
            "");

    private final String pythonExecutable;

    public PythonBytecodeCompiler(String pythonExecutable) {
        this.pythonExecutable = pythonExecutable;
    }

    @Override
    public CompilationReport compile(List<Path> sources) throws PackagingException {
        if (sources.isEmpty())
            return CompilationReport.empty();

        Path listing = null;
        try {
            listing = Files.createTempFile("fnpack-sources-", ".txt");
            List<String> lines = new ArrayList<>();
            for (Path source : sources) {
                lines.add(source.toAbsolutePath().toString());
            }
            Files.write(listing, lines, StandardCharsets.UTF_8);

            return run(listing);
        } catch (IOException e) {
            throw new PackagingException("Failed to run " + pythonExecutable + " for bytecode compilation", e);
        } finally {
            deleteListing(listing);
        }
    }

    private CompilationReport run(Path listing) throws IOException, PackagingException {
        ProcessBuilder pb = new ProcessBuilder(pythonExecutable, "-c", COMPILE_SCRIPT, listing.toString());
        pb.redirectErrorStream(true);
        pb.environment().put("PYTHONIOENCODING", "utf-8");
        pb.environment().put("PYTHONDONTWRITEBYTECODE", "1");

        Process process = pb.start();

        List<Path> compiled = new ArrayList<>();
        List<CompilationReport.Failure> failures = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                parseLine(line, compiled, failures);
            }
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new PackagingException("Interrupted while compiling sources", e);
        }
        if (exitCode != 0)
            throw new PackagingException(pythonExecutable + " exited with code " + exitCode
                    + " during bytecode compilation");

        LOG.info("Compiled {} sources, {} failed", compiled.size(), failures.size());
        return new CompilationReport(compiled, failures);
    }

    static void parseLine(String line, List<Path> compiled, List<CompilationReport.Failure> failures) {
        if (line.startsWith(OK_PREFIX)) {
            compiled.add(Path.of(line.substring(OK_PREFIX.length())));
        } else if (line.startsWith(FAIL_PREFIX)) {
            String rest = line.substring(FAIL_PREFIX.length());
            int tab = rest.indexOf('\t');
            Path source = Path.of(tab < 0 ? rest : rest.substring(0, tab));
            String message = tab < 0 ? "" : rest.substring(tab + 1);
            LOG.warn("Failed to compile {}: {}", source, message);
            failures.add(new CompilationReport.Failure(source, message));
        } else {
            LOG.debug("[python] {}", line);
        }
    }

    private static void deleteListing(Path listing) {
        if (listing == null)
            return;
        try {
            Files.deleteIfExists(listing);
        } catch (IOException e) {
            LOG.warn("Could not delete source listing {}", listing, e);
        }
    }

    public String pythonExecutable() {
        return pythonExecutable;
    }
}
