package de.bsommerfeld.fnpack.packager.build;

import de.bsommerfeld.fnpack.core.error.PackagingException;

import java.nio.file.Path;
import java.util.List;

/**
 * Compiles Python sources into legacy {@code .pyc} files next to them.
 */
public interface BytecodeCompiler {

    /**
     * Compiles {@code sources}. A source that fails to compile is reported,
     * not thrown.
     *
     * @throws PackagingException if the compiler itself cannot run
     */
    CompilationReport compile(List<Path> sources) throws PackagingException;
}
