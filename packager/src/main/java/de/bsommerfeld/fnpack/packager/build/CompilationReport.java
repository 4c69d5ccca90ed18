package de.bsommerfeld.fnpack.packager.build;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one compiler run.
 *
 * @param compiled sources that now have a {@code .pyc} sibling
 * @param failures sources that did not compile
 */
public record CompilationReport(List<Path> compiled, List<Failure> failures) {

    public record Failure(Path source, String message) {
    }

    public CompilationReport {
        compiled = List.copyOf(compiled);
        failures = List.copyOf(failures);
    }

    public static CompilationReport empty() {
        return new CompilationReport(List.of(), List.of());
    }
}
