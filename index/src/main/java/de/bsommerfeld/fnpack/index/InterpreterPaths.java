package de.bsommerfeld.fnpack.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Asks a Python interpreter for its module search path ({@code sys.path}).
 *
 * <p>
 * Used when no site-packages directories are configured: the packaged
 * project must be installed into the same environment the interpreter runs
 * in, so its search path is exactly where the installed distributions live.
 * Empty entries (the current directory) are dropped.
 */
public final class InterpreterPaths {

    private static final Logger LOG = LoggerFactory.getLogger(InterpreterPaths.class);

    private static final long TIMEOUT_SECONDS = 30;

    static final String PRINT_SYS_PATH = "import sys\nfor p in sys.path:\n    if p:\n        print(p)\n";

    private InterpreterPaths() {
    }

    /**
     * Runs {@code python -c <script>} and returns the printed search path.
     *
     * @throws IOException if the interpreter cannot be started, times out,
     *                     or exits with a non-zero status
     */
    public static List<Path> query(String pythonExecutable) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(pythonExecutable, "-c", PRINT_SYS_PATH)
                .redirectErrorStream(true);
        Process process = pb.start();

        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }

        awaitSuccess(process, pythonExecutable, lines);
        List<Path> paths = toPaths(lines);
        LOG.debug("Search path of {}: {}", pythonExecutable, paths);
        return paths;
    }

    static List<Path> toPaths(List<String> lines) {
        return lines.stream()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .map(Path::of)
                .toList();
    }

    private static void awaitSuccess(Process process, String executable, List<String> output) throws IOException {
        try {
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException(executable + " did not report its search path within "
                        + TIMEOUT_SECONDS + " seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while querying " + executable, e);
        }
        if (process.exitValue() != 0) {
            throw new IOException(executable + " exited with code " + process.exitValue() + ": "
                    + String.join("\n", output));
        }
    }
}
